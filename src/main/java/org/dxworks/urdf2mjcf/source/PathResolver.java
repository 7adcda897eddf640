package org.dxworks.urdf2mjcf.source;

import org.dxworks.urdf2mjcf.ConversionLog;
import org.dxworks.urdf2mjcf.model.TransformEvent.Kind;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves paths found in source documents to absolute file system paths.
 * Understands {@code package://pkg/rel}, {@code file://}, {@code $(find pkg)/rel}
 * and {@code ${env:VAR}} besides plain relative and absolute paths.
 * Packages are looked up in the {@code share} directories of {@code AMENT_PREFIX_PATH}
 * and directly under the entries of {@code ROS_PACKAGE_PATH}.
 */
public class PathResolver {
    private static final Pattern ENV_PATTERN = Pattern.compile("\\$\\{env:([^}]+)}");
    private static final Pattern FIND_PATTERN = Pattern.compile("\\$\\(find\\s+([^)]+)\\)(.*)");

    private final Map<String, String> environment;
    private final ConversionLog log;

    public PathResolver(Map<String, String> environment, ConversionLog log) {
        this.environment = environment;
        this.log = log;
    }

    /** Absolute path, or null when the path is empty or names an unknown package. */
    public String resolve(String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        String expanded = path.contains("${env:") ? expandEnvironment(path) : path;

        if (expanded.startsWith("package://")) {
            String rest = expanded.substring("package://".length());
            int slash = rest.indexOf('/');
            String packageName = slash >= 0 ? rest.substring(0, slash) : rest;
            String relative = slash >= 0 ? rest.substring(slash + 1) : "";
            Optional<Path> share = packageShareDirectory(packageName);
            if (share.isEmpty()) {
                log.warn(Kind.PRECONDITION, "Could not resolve package '" + packageName + "'");
                return null;
            }
            return share.get().resolve(relative).toAbsolutePath().normalize().toString();
        }

        if (expanded.startsWith("file://")) {
            String filePath = expanded.substring("file://".length());
            if (filePath.contains("$(find")) {
                String found = resolveFind(filePath, "file URI");
                if (found != null) {
                    return found;
                }
            } else if (Files.exists(Paths.get(filePath))) {
                return Paths.get(filePath).toAbsolutePath().normalize().toString();
            }
            return Paths.get(stripLeadingSlashes(filePath)).toAbsolutePath().normalize().toString();
        }

        String found = resolveFind(expanded, "");
        if (found != null) {
            return found;
        }
        return Paths.get(expanded).toAbsolutePath().normalize().toString();
    }

    Optional<Path> packageShareDirectory(String packageName) {
        String amentPrefixes = environment.get("AMENT_PREFIX_PATH");
        if (amentPrefixes != null) {
            for (String prefix : amentPrefixes.split(File.pathSeparator)) {
                if (prefix.isBlank()) continue;
                Path share = Paths.get(prefix, "share", packageName);
                if (Files.isDirectory(share)) {
                    return Optional.of(share);
                }
            }
        }
        String rosPackagePath = environment.get("ROS_PACKAGE_PATH");
        if (rosPackagePath != null) {
            for (String root : rosPackagePath.split(File.pathSeparator)) {
                if (root.isBlank()) continue;
                Path candidate = Paths.get(root, packageName);
                if (Files.isDirectory(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    private String resolveFind(String path, String context) {
        Matcher m = FIND_PATTERN.matcher(path);
        if (!m.matches()) {
            return null;
        }
        String packageName = m.group(1).trim();
        String relative = stripLeadingSlashes(m.group(2));
        log.info("Resolving for package '" + packageName + "' with relative path '" + relative + "'");
        Optional<Path> share = packageShareDirectory(packageName);
        if (share.isEmpty()) {
            String where = context.isEmpty() ? "" : " in " + context;
            log.warn(Kind.PRECONDITION, "Could not resolve package '" + packageName + "'" + where + ".");
            return null;
        }
        return share.get().resolve(relative).toAbsolutePath().normalize().toString();
    }

    private String expandEnvironment(String path) {
        Matcher m = ENV_PATTERN.matcher(path);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String name = m.group(1);
            String value = environment.get(name);
            if (value != null) {
                log.info("Resolved environment variable '" + name + "' to '" + value + "'");
                m.appendReplacement(sb, Matcher.quoteReplacement(value));
            } else {
                log.warn(Kind.PRECONDITION, "Environment variable '" + name + "' not found.");
                m.appendReplacement(sb, Matcher.quoteReplacement(m.group(0)));
            }
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String stripLeadingSlashes(String path) {
        int i = 0;
        while (i < path.length() && path.charAt(i) == '/') {
            i++;
        }
        return path.substring(i);
    }
}
