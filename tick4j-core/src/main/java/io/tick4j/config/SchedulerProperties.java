package io.tick4j.config;

import io.tick4j.core.ConfigurationException;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneId;
import java.util.Properties;

/**
 * Runtime configuration for scheduler behavior.
 *
 * <p>Can be bound from {@code tick4j.*} keys with {@link #from(Properties)}:
 * <pre>
 * tick4j.minutes=5
 * tick4j.timezone=Europe/Berlin
 * tick4j.lock-directory=/var/lock/tick4j
 * tick4j.locking=true
 * tick4j.table-name=tick4j_jobs
 * </pre>
 */
public class SchedulerProperties {
    public static final String PREFIX = "tick4j.";

    private int minutes = 1;
    private String timezone; // null = system default
    private String lockDirectory; // null = java.io.tmpdir
    private boolean locking = true;
    private String tableName = "tick4j_jobs";

    public static SchedulerProperties from(Properties source) {
        SchedulerProperties props = new SchedulerProperties();
        if (source == null) {
            return props;
        }

        String minutes = source.getProperty(PREFIX + "minutes");
        if (minutes != null) {
            try {
                props.setMinutes(Integer.parseInt(minutes.trim()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException(PREFIX + "minutes must be an integer: " + minutes, e);
            }
        }

        String timezone = source.getProperty(PREFIX + "timezone");
        if (timezone != null && !timezone.isBlank()) {
            props.setTimezone(timezone.trim());
        }

        String lockDirectory = source.getProperty(PREFIX + "lock-directory");
        if (lockDirectory != null && !lockDirectory.isBlank()) {
            props.setLockDirectory(lockDirectory.trim());
        }

        String locking = source.getProperty(PREFIX + "locking");
        if (locking != null) {
            props.setLocking(Boolean.parseBoolean(locking.trim()));
        }

        String tableName = source.getProperty(PREFIX + "table-name");
        if (tableName != null && !tableName.isBlank()) {
            props.setTableName(tableName.trim());
        }
        return props;
    }

    public int getMinutes() {
        return minutes;
    }

    public void setMinutes(int minutes) {
        this.minutes = minutes;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    /**
     * Configured zone, or the system default when unset.
     *
     * @throws ConfigurationException if the timezone id is not a valid IANA zone
     */
    public ZoneId zoneId() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone);
        } catch (Exception e) {
            throw new ConfigurationException("Invalid timezone: " + timezone, e);
        }
    }

    public String getLockDirectory() {
        return lockDirectory;
    }

    public void setLockDirectory(String lockDirectory) {
        this.lockDirectory = lockDirectory;
    }

    public Path lockDirectoryPath() {
        if (lockDirectory == null || lockDirectory.isBlank()) {
            return Paths.get(System.getProperty("java.io.tmpdir"));
        }
        return Paths.get(lockDirectory);
    }

    public boolean isLocking() {
        return locking;
    }

    public void setLocking(boolean locking) {
        this.locking = locking;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }
}
