package com.errorbuddy.service.environment;

import com.errorbuddy.config.ReporterProperties;
import org.springframework.boot.SpringBootVersion;
import org.springframework.core.SpringVersion;
import org.springframework.core.env.Environment;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Default environment facts: runtime, framework, memory and active integrations.
 */
public final class JvmEnvironmentProbes {

    private static final long MIB = 1024L * 1024L;

    private JvmEnvironmentProbes() {
    }

    public static List<EnvironmentProbe> defaults(ReporterProperties properties,
                                                  Environment environment,
                                                  List<String> integrations) {
        List<EnvironmentProbe> probes = new ArrayList<>();

        probes.add(EnvironmentProbe.of("java_version", () -> System.getProperty("java.version")));
        probes.add(EnvironmentProbe.of("java_vendor", () -> System.getProperty("java.vendor")));
        probes.add(EnvironmentProbe.of("os", () -> System.getProperty("os.name") + " "
                + System.getProperty("os.version") + " (" + System.getProperty("os.arch") + ")"));
        probes.add(EnvironmentProbe.of("spring_boot_version", SpringBootVersion::getVersion));
        probes.add(EnvironmentProbe.of("spring_version", SpringVersion::getVersion));
        probes.add(EnvironmentProbe.of("app_version", () -> orUnknown(properties.getAppVersion())));
        probes.add(EnvironmentProbe.of("site_id", properties::getSiteId));
        probes.add(EnvironmentProbe.of("max_memory", () -> megabytes(Runtime.getRuntime().maxMemory())));
        probes.add(EnvironmentProbe.of("used_memory", () -> {
            Runtime runtime = Runtime.getRuntime();
            return megabytes(runtime.totalMemory() - runtime.freeMemory());
        }));
        probes.add(EnvironmentProbe.of("available_processors", () -> Runtime.getRuntime().availableProcessors()));
        probes.add(EnvironmentProbe.of("timezone", () -> ZoneId.systemDefault().getId()));
        probes.add(EnvironmentProbe.of("active_profiles", () -> {
            String[] profiles = environment.getActiveProfiles();
            return profiles.length == 0 ? "default" : Arrays.asList(profiles);
        }));
        probes.add(EnvironmentProbe.of("active_integrations", () -> integrations));

        return probes;
    }

    private static String megabytes(long bytes) {
        return (bytes / MIB) + "M";
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }
}
