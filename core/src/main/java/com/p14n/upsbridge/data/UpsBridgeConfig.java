package com.p14n.upsbridge.data;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public interface UpsBridgeConfig {
    public String nutHost();

    public int nutPort();

    public String nutUpsName();

    public String nutDeviceId();

    public String nutDeviceName();

    public String deviceManufacturer();

    public String deviceModel();

    public int nutPollIntervalSeconds();

    public String mqttBroker();

    public int mqttPort();

    public String mqttUser();

    public String mqttPassword();

    public String mqttClientId();

    public String namespace();

    public String dbHost();

    public int dbPort();

    public String dbName();

    public String dbUser();

    public String dbPassword();

    public int saveIntervalSeconds();

    public int maxUntrackedDevices();

    public int healthCheckPort();

    public List<String> deviceIds();

    public Map<String, String> storageKeys();

    public Map<String, String> friendlyNames();

    public default Duration pollInterval() {
        return Duration.ofSeconds(nutPollIntervalSeconds());
    }

    public default Duration saveInterval() {
        return Duration.ofSeconds(saveIntervalSeconds());
    }

    public default String mqttAddress() {
        return String.format("tcp://%s:%d", mqttBroker(), mqttPort());
    }

    public default String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s",
                dbHost(), dbPort(), dbName());
    }
}
