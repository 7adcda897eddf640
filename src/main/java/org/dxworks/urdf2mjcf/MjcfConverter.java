package org.dxworks.urdf2mjcf;

import org.dxworks.urdf2mjcf.actuator.ActuatorSynthesizer;
import org.dxworks.urdf2mjcf.model.Element;
import org.dxworks.urdf2mjcf.model.MjcfDocument;
import org.dxworks.urdf2mjcf.postprocess.ModelPostProcessor;
import org.dxworks.urdf2mjcf.source.PathResolver;
import org.dxworks.urdf2mjcf.source.UrdfSource;
import org.dxworks.urdf2mjcf.source.UrdfSourceExtractor;
import org.dxworks.urdf2mjcf.transform.FragmentDispatcher;
import org.dxworks.urdf2mjcf.transform.PluginTransformer;
import org.dxworks.urdf2mjcf.xml.XmlReader;

import java.nio.file.Path;
import java.util.Map;

/**
 * Runs one conversion: reads the robot description, post-processes the baseline
 * model and folds the description's annotations into it. The baseline tree is
 * mutated in place.
 */
public class MjcfConverter {
    private final ConverterConfig config;
    private final Map<String, String> environment;

    public MjcfConverter(ConverterConfig config) {
        this(config, System.getenv());
    }

    public MjcfConverter(ConverterConfig config, Map<String, String> environment) {
        this.config = config;
        this.environment = environment;
    }

    public ConversionResult convert(Path baseline, Path urdf) throws ConversionException {
        Element urdfRoot = XmlReader.read(urdf);
        Element baselineRoot = XmlReader.read(baseline);
        return convert(baselineRoot, urdfRoot);
    }

    public ConversionResult convert(Element baselineRoot, Element urdfRoot) {
        ConversionLog log = new ConversionLog();
        MjcfDocument document = new MjcfDocument(baselineRoot);

        UrdfSource source = new UrdfSourceExtractor(log)
                .extract(urdfRoot, config.getMeshDir(), config.getCompilerOptions());
        ModelPostProcessor post = new ModelPostProcessor(document, log);

        if (config.getDampingMultiplier() != 1.0) {
            post.multiplyJointDamping(config.getDampingMultiplier());
        }

        PluginTransformer plugins = new PluginTransformer(document, new PathResolver(environment, log), log);
        for (Element plugin : source.plugins) {
            plugins.transform(plugin);
        }
        post.applyCompilerOptions(source.compilerAttributes);
        post.addLight();

        if (config.isAddClockPublisher()) {
            post.addClockPublisherPlugin();
        }
        if (config.isAddRos2Control()) {
            post.addRos2ControlPlugin(config.getRos2ControlInstance(), config.getRos2ControlConfig());
        }
        post.groupRosUtilsPlugins();

        if (config.isFloatingBase()) {
            post.makeBaseFloating(config.getHeightAboveFloor());
        }
        if (config.isAddFloor()) {
            post.addFloor();
        }
        if (!config.isNoActuators()) {
            ActuatorSynthesizer actuators = new ActuatorSynthesizer(document, log);
            actuators.addActuators(source.interfaces, source.mimics, config.getDefaultActuatorGains(),
                    config.isForceActuatorSuffix(), config.isAddRosPlugins(), config.getRos2ControlInstance());
            if (config.isAddMimicJoints() && !source.mimics.isEmpty()) {
                actuators.addMimicPlugins(source.mimics, config.getDefaultActuatorGains());
            }
            post.groupRosUtilsPlugins();
        }

        if (config.isGravityCompensation()) {
            post.enableGravityCompensation();
        }
        if (config.getArmature() != null) {
            post.setJointArmature(config.getArmature());
        }
        post.setSimulationOptions(config.getSolver(), config.getIntegrator());

        new FragmentDispatcher(document, log).dispatch(source.fragments);
        post.groupRosUtilsPlugins();

        return new ConversionResult(document, log);
    }
}
