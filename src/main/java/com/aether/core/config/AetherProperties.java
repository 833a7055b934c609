package com.aether.core.config;

import com.aether.core.detection.DetectionProfile;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "aether")
public class AetherProperties {

    private Detection detection = new Detection();
    private Mission mission = new Mission();
    private History history = new History();
    private Runtime runtime = new Runtime();
    private Dispatch dispatch = new Dispatch();

    /**
     * Resolves the detection profile for a tenant name, falling back to the
     * default profile when the name is null or not configured.
     */
    public DetectionProfile detectionProfile(String name) {
        Profile profile = name != null ? detection.profiles.get(name) : null;
        if (profile == null) {
            profile = detection.profiles.get(detection.defaultProfile);
        }
        if (profile == null) {
            profile = new Profile();
        }
        return profile.toDetectionProfile();
    }

    public Detection getDetection() { return detection; }
    public void setDetection(Detection detection) { this.detection = detection; }
    public Mission getMission() { return mission; }
    public void setMission(Mission mission) { this.mission = mission; }
    public History getHistory() { return history; }
    public void setHistory(History history) { this.history = history; }
    public Runtime getRuntime() { return runtime; }
    public void setRuntime(Runtime runtime) { this.runtime = runtime; }
    public Dispatch getDispatch() { return dispatch; }
    public void setDispatch(Dispatch dispatch) { this.dispatch = dispatch; }

    public static class Detection {
        private String defaultProfile = "default";
        private Map<String, Profile> profiles = new LinkedHashMap<>();

        public String getDefaultProfile() { return defaultProfile; }
        public void setDefaultProfile(String defaultProfile) { this.defaultProfile = defaultProfile; }
        public Map<String, Profile> getProfiles() { return profiles; }
        public void setProfiles(Map<String, Profile> profiles) { this.profiles = profiles; }
    }

    public static class Profile {
        private double minDurationSeconds = 30.0;
        private double minDistanceMeters = 10.0;
        private boolean requireGpsLock = true;
        private double disarmTimeoutSeconds = 0.0;

        public double getMinDurationSeconds() { return minDurationSeconds; }
        public void setMinDurationSeconds(double minDurationSeconds) { this.minDurationSeconds = minDurationSeconds; }
        public double getMinDistanceMeters() { return minDistanceMeters; }
        public void setMinDistanceMeters(double minDistanceMeters) { this.minDistanceMeters = minDistanceMeters; }
        public boolean isRequireGpsLock() { return requireGpsLock; }
        public void setRequireGpsLock(boolean requireGpsLock) { this.requireGpsLock = requireGpsLock; }
        public double getDisarmTimeoutSeconds() { return disarmTimeoutSeconds; }
        public void setDisarmTimeoutSeconds(double disarmTimeoutSeconds) { this.disarmTimeoutSeconds = disarmTimeoutSeconds; }

        DetectionProfile toDetectionProfile() {
            return new DetectionProfile(
                    Duration.ofMillis(Math.round(minDurationSeconds * 1000)),
                    minDistanceMeters,
                    requireGpsLock,
                    Duration.ofMillis(Math.round(disarmTimeoutSeconds * 1000)));
        }
    }

    public static class Mission {
        private long commandAckTimeoutMs = 5000;
        private int commandMaxRetries = 3;
        private double waypointToleranceMeters = 2.0;
        private long connectivityGraceSeconds = 60;
        private int minGpsFix = 3;
        private long signalTimeoutMs = 5000;

        public long getCommandAckTimeoutMs() { return commandAckTimeoutMs; }
        public void setCommandAckTimeoutMs(long commandAckTimeoutMs) { this.commandAckTimeoutMs = commandAckTimeoutMs; }
        public int getCommandMaxRetries() { return commandMaxRetries; }
        public void setCommandMaxRetries(int commandMaxRetries) { this.commandMaxRetries = commandMaxRetries; }
        public double getWaypointToleranceMeters() { return waypointToleranceMeters; }
        public void setWaypointToleranceMeters(double waypointToleranceMeters) { this.waypointToleranceMeters = waypointToleranceMeters; }
        public long getConnectivityGraceSeconds() { return connectivityGraceSeconds; }
        public void setConnectivityGraceSeconds(long connectivityGraceSeconds) { this.connectivityGraceSeconds = connectivityGraceSeconds; }
        public int getMinGpsFix() { return minGpsFix; }
        public void setMinGpsFix(int minGpsFix) { this.minGpsFix = minGpsFix; }
        public long getSignalTimeoutMs() { return signalTimeoutMs; }
        public void setSignalTimeoutMs(long signalTimeoutMs) { this.signalTimeoutMs = signalTimeoutMs; }
    }

    public static class History {
        private String store = "jdbc";
        private int compactEveryEvents = 500;
        private long compactIntervalSeconds = 300;
        private int failureAlertThreshold = 3;

        public String getStore() { return store; }
        public void setStore(String store) { this.store = store; }
        public int getCompactEveryEvents() { return compactEveryEvents; }
        public void setCompactEveryEvents(int compactEveryEvents) { this.compactEveryEvents = compactEveryEvents; }
        public long getCompactIntervalSeconds() { return compactIntervalSeconds; }
        public void setCompactIntervalSeconds(long compactIntervalSeconds) { this.compactIntervalSeconds = compactIntervalSeconds; }
        public int getFailureAlertThreshold() { return failureAlertThreshold; }
        public void setFailureAlertThreshold(int failureAlertThreshold) { this.failureAlertThreshold = failureAlertThreshold; }
    }

    public static class Runtime {
        private boolean enabled = true;
        private int workerThreads = 8;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    public static class Dispatch {
        private int maxAttempts = 3;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    }
}
