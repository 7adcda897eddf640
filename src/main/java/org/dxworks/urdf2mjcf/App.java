package org.dxworks.urdf2mjcf;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.urdf2mjcf.model.TransformEvent;
import org.dxworks.urdf2mjcf.xml.XmlWriter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 3) {
            System.err.println("Usage: java -jar urdf2mjcf.jar <source-urdf> <baseline-mjcf> <output-mjcf>");
            System.err.println("  <source-urdf>:   URDF file carrying <mujoco> annotations and ros2_control blocks");
            System.err.println("  <baseline-mjcf>: MJCF compiled from the URDF by MuJoCo");
            System.err.println("  <output-mjcf>:   Path of the post-processed MJCF to write");
            System.exit(2);
        }

        Path urdf = Paths.get(args[0]);
        Path baseline = Paths.get(args[1]);
        Path output = Paths.get(args[2]);
        for (Path input : List.of(urdf, baseline)) {
            if (!Files.isRegularFile(input)) {
                System.err.println("Error: Input file does not exist: " + input);
                System.exit(1);
            }
        }

        System.out.println("Starting URDF to MJCF post-processing...");
        System.out.println("URDF: " + urdf.toAbsolutePath());
        System.out.println("Baseline MJCF: " + baseline.toAbsolutePath());

        Instant startTime = Instant.now();
        ConversionResult result;
        try {
            result = new MjcfConverter(ConverterConfig.load()).convert(baseline, urdf);
            XmlWriter.write(result.document.getRoot(), output);
        } catch (ConversionException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
            return;
        }

        Path report = Paths.get(output + ".events.jsonl");
        int warnings = result.log.warnings().size();
        writeReport(report, urdf, baseline, output, result.log.getEvents(), warnings, startTime);

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Successfully converted URDF to MJCF.");
        if (warnings > 0) {
            System.out.println("Warnings: " + warnings);
        }
        System.out.println("Output saved to: " + output.toAbsolutePath());
        System.out.println("Events written to: " + report.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static void writeReport(Path report, Path urdf, Path baseline, Path output,
                            List<TransformEvent> events, int warnings, Instant startTime) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(report, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("urdf_path", urdf.toString());
            runInfo.put("baseline_path", baseline.toString());
            runInfo.put("output_path", output.toString());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            for (TransformEvent event : events) {
                writer.write(MAPPER.writeValueAsString(event));
                writer.newLine();
            }

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("events", events.size());
            doneInfo.put("warnings", warnings);
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }
    }
}
