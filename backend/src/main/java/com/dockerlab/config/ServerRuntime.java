package com.dockerlab.config;

import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Process-level facts shared by the handlers: when the service started and how
 * much heap it is using.
 */
@Component
public class ServerRuntime {

    private static final long MB = 1024L * 1024L;

    private final Clock clock;

    @Getter
    private final Instant startTime;

    public ServerRuntime() {
        this(Clock.systemUTC());
    }

    ServerRuntime(Clock clock) {
        this.clock = clock;
        this.startTime = clock.instant();
    }

    public Instant now() {
        return clock.instant();
    }

    public Duration uptime() {
        Duration uptime = Duration.between(startTime, clock.instant());
        return uptime.isNegative() ? Duration.ZERO : uptime;
    }

    /**
     * Uptime as {@code "1d 2h 3m 4s"}.
     */
    public String formattedUptime() {
        return formatUptime(uptime());
    }

    public static String formatUptime(Duration uptime) {
        long totalSeconds = uptime.getSeconds();
        long days = totalSeconds / 86_400;
        long hours = (totalSeconds % 86_400) / 3_600;
        long minutes = (totalSeconds % 3_600) / 60;
        long seconds = totalSeconds % 60;
        return days + "d " + hours + "h " + minutes + "m " + seconds + "s";
    }

    public long heapUsedMb() {
        Runtime runtime = Runtime.getRuntime();
        return Math.round((runtime.totalMemory() - runtime.freeMemory()) / (double) MB);
    }

    public long heapCommittedMb() {
        return Math.round(Runtime.getRuntime().totalMemory() / (double) MB);
    }

    public long heapMaxMb() {
        return Math.round(Runtime.getRuntime().maxMemory() / (double) MB);
    }

    public String javaVersion() {
        return System.getProperty("java.version");
    }
}
