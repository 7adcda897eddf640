package org.dxworks.urdf2mjcf.transform;

import org.dxworks.urdf2mjcf.ConversionLog;
import org.dxworks.urdf2mjcf.model.Element;
import org.dxworks.urdf2mjcf.model.MjcfDocument;
import org.dxworks.urdf2mjcf.model.TransformEvent.Kind;
import org.dxworks.urdf2mjcf.source.PathResolver;

import java.util.Map;

/**
 * Turns a source-side {@code <plugin filename="..." name="...">} into an MJCF
 * extension plugin with one instance. Every child becomes a config entry whose
 * value is the child's text resolved as a path.
 */
public class PluginTransformer {
    private final MjcfDocument document;
    private final PathResolver pathResolver;
    private final ConversionLog log;

    public PluginTransformer(MjcfDocument document, PathResolver pathResolver, ConversionLog log) {
        this.document = document;
        this.pathResolver = pathResolver;
        this.log = log;
    }

    public void transform(Element sourcePlugin) {
        String pluginName = sourcePlugin.get("filename");
        if (pluginName == null || pluginName.isEmpty()) {
            log.warn(Kind.PRECONDITION, "Skipping custom <plugin> tag with no 'filename' attribute.").withTag("plugin");
            return;
        }
        String instanceName = sourcePlugin.get("name", pluginName);

        Element extension = document.ensureExtension();
        Element plugin = extension.appendChild("plugin", Map.of("plugin", pluginName));
        Element instance = plugin.appendChild("instance", Map.of("name", instanceName));

        boolean hasParams = false;
        for (Element param : sourcePlugin.getChildren()) {
            String raw = param.getTrimmedText();
            String resolved = pathResolver.resolve(raw);
            if (resolved == null || resolved.isEmpty()) {
                log.warn(Kind.PRECONDITION, "Could not resolve path for plugin parameter '" + param.getTag()
                        + "': " + raw + ". Skipping this parameter.");
                continue;
            }
            Element config = new Element("config");
            config.set("key", param.getTag());
            config.set("value", resolved);
            instance.append(config);
            hasParams = true;
        }

        log.info(Kind.ELEMENT_CREATED, "-> Transformed and added custom plugin '" + pluginName + "'"
                + (hasParams ? " with parameters." : ".")).withTag("plugin");
    }
}
