package com.marker;

import com.marker.evaluator.MarkerEvaluator;
import com.marker.exception.MarkerParseException;
import com.marker.spring.EnableMarkers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Command-line entry point: evaluates each argument as a marker against the configured environment.
 * <p>
 * Example:
 * <pre>
 * java -jar marker.jar "python_version >= '3.8'" "sys_platform == 'win32'"
 * </pre>
 */
@SpringBootApplication
@EnableMarkers
public class MarkerApplication {

    private static final Logger log = LoggerFactory.getLogger(MarkerApplication.class);

    private static final List<String> SAMPLE_MARKERS = List.of(
            "python_version >= '3.8'",
            "sys_platform == 'win32' or (os_name == 'posix' and platform_machine == 'x86_64')",
            "extra == 'dev' and implementation_name == 'cpython'"
    );

    public static void main(String[] args) {
        SpringApplication.run(MarkerApplication.class, args);
    }

    @Bean
    public CommandLineRunner evaluateMarkers(MarkerEvaluator evaluator) {
        return args -> {
            List<String> markers = args.length == 0 ? SAMPLE_MARKERS : List.of(args);
            for (String marker : markers) {
                try {
                    boolean result = evaluator.evaluate(marker);
                    boolean applies = evaluator.applies(marker);
                    log.info("{} -> {} (possible for configured python versions: {})", marker, result, applies);
                } catch (MarkerParseException e) {
                    log.error("Skipping marker: {}", e.getMessage());
                }
            }
        };
    }
}
