package com.p14n.upsbridge.data;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The fields of a UPS device record. Each constant carries its topic name, its
 * value type, the NUT variable it is read from and the metadata the dashboard
 * needs to render it.
 */
public enum UpsField {
    BATTERY_CHARGE("battery_charge", FieldType.DECIMAL, "battery.charge", "Battery Charge", "%", "battery", "measurement", null, true),
    BATTERY_VOLTAGE("battery_voltage", FieldType.DECIMAL, "battery.voltage", "Battery Voltage", "V", "voltage", "measurement", null, true),
    BATTERY_RUNTIME("battery_runtime", FieldType.INTEGER, "battery.runtime", "Battery Runtime", "s", "duration", "measurement", "mdi:timer-outline", true),
    BATTERY_NOMINAL_VOLTAGE("battery_nominal_voltage", FieldType.DECIMAL, "battery.voltage.nominal", "Battery Nominal Voltage", "V", "voltage", "measurement", null, false),
    BATTERY_LOW_CHARGE_THRESHOLD("battery_low_charge_threshold", FieldType.DECIMAL, "battery.charge.low", "Battery Low Charge Threshold", "%", "battery", "measurement", null, true),
    BATTERY_WARNING_CHARGE_THRESHOLD("battery_warning_charge_threshold", FieldType.DECIMAL, "battery.charge.warning", "Battery Warning Charge Threshold", "%", "battery", "measurement", null, true),

    INPUT_VOLTAGE("input_voltage", FieldType.DECIMAL, "input.voltage", "Input Voltage", "V", "voltage", "measurement", null, true),
    INPUT_NOMINAL_VOLTAGE("input_nominal_voltage", FieldType.INTEGER, "input.voltage.nominal", "Input Nominal Voltage", "V", "voltage", "measurement", null, true),
    HIGH_VOLTAGE_TRANSFER("high_voltage_transfer", FieldType.DECIMAL, "input.transfer.high", "High Voltage Transfer", "V", "voltage", "measurement", null, true),
    LOW_VOLTAGE_TRANSFER("low_voltage_transfer", FieldType.DECIMAL, "input.transfer.low", "Low Voltage Transfer", "V", "voltage", "measurement", null, true),
    INPUT_SENSITIVITY("input_sensitivity", FieldType.TEXT, "input.sensitivity", "Input Sensitivity", null, null, null, "mdi:tune", true),
    LAST_TRANSFER_REASON("last_transfer_reason", FieldType.TEXT, "input.transfer.reason", "Last Transfer Reason", null, null, null, "mdi:information-outline", true),

    LOAD_PERCENTAGE("load_percentage", FieldType.DECIMAL, "ups.load", "Load", "%", "power_factor", "measurement", "mdi:gauge", true),
    LOAD_WATTS("load_watts", FieldType.DECIMAL, null, "Load Power", "W", "power", "measurement", null, true),
    UPS_STATUS("ups_status", FieldType.TEXT, "ups.status", "UPS Status", null, null, null, "mdi:information", true),
    POWER_FAILURE("power_failure", FieldType.FLAG, null, "Power Failure", null, "power", null, "mdi:power-plug-off", true),

    UPS_NOMINAL_POWER("ups_nominal_power", FieldType.DECIMAL, "ups.realpower.nominal", "Nominal Power", "W", "power", "measurement", null, false),
    BEEPER_STATUS("beeper_status", FieldType.TEXT, "ups.beeper.status", "Beeper Status", null, null, null, "mdi:volume-high", true),
    SELF_TEST_RESULT("self_test_result", FieldType.TEXT, "ups.test.result", "Self Test Result", null, null, null, "mdi:clipboard-check", true),
    FIRMWARE_VERSION("firmware_version", FieldType.TEXT, "ups.firmware", "Firmware Version", null, null, null, "mdi:chip", false),

    DRIVER_NAME("driver_name", FieldType.TEXT, "driver.name", "Driver Name", null, null, null, "mdi:application", false),
    DRIVER_VERSION("driver_version", FieldType.TEXT, "driver.version", "Driver Version", null, null, null, "mdi:tag", false),
    DRIVER_STATE("driver_state", FieldType.TEXT, "driver.state", "Driver State", null, null, null, "mdi:state-machine", true),

    TEMPERATURE("temperature", FieldType.DECIMAL, "ups.temperature", "Temperature", "°C", "temperature", "measurement", null, true),
    OUTPUT_VOLTAGE("output_voltage", FieldType.DECIMAL, "output.voltage", "Output Voltage", "V", "voltage", "measurement", null, true),
    OUTPUT_NOMINAL_VOLTAGE("output_nominal_voltage", FieldType.INTEGER, "output.voltage.nominal", "Output Nominal Voltage", "V", "voltage", "measurement", null, true);

    private static final Map<String, UpsField> BY_NAME;

    static {
        Map<String, UpsField> m = new HashMap<>();
        for (UpsField f : values()) {
            m.put(f.topicName, f);
        }
        // names used by other NUT firmwares
        m.put("battery_voltage_nominal", BATTERY_NOMINAL_VOLTAGE);
        m.put("battery_charge_low", BATTERY_LOW_CHARGE_THRESHOLD);
        m.put("battery_charge_warning", BATTERY_WARNING_CHARGE_THRESHOLD);
        m.put("input_voltage_nominal", INPUT_NOMINAL_VOLTAGE);
        m.put("input_transfer_high", HIGH_VOLTAGE_TRANSFER);
        m.put("input_transfer_low", LOW_VOLTAGE_TRANSFER);
        m.put("load_percent", LOAD_PERCENTAGE);
        m.put("status", UPS_STATUS);
        m.put("input_transfer_reason", LAST_TRANSFER_REASON);
        BY_NAME = Collections.unmodifiableMap(m);
    }

    private final String topicName;
    private final FieldType type;
    private final String nutVariable;
    private final String displayName;
    private final String unit;
    private final String deviceClass;
    private final String stateClass;
    private final String icon;
    private final boolean persisted;

    UpsField(String topicName, FieldType type, String nutVariable, String displayName, String unit,
            String deviceClass, String stateClass, String icon, boolean persisted) {
        this.topicName = topicName;
        this.type = type;
        this.nutVariable = nutVariable;
        this.displayName = displayName;
        this.unit = unit;
        this.deviceClass = deviceClass;
        this.stateClass = stateClass;
        this.icon = icon;
        this.persisted = persisted;
    }

    /**
     * Resolves a topic field name or one of its aliases.
     */
    public static Optional<UpsField> byName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public String topicName() {
        return topicName;
    }

    public FieldType type() {
        return type;
    }

    /**
     * @return the NUT variable, or empty for derived fields
     */
    public Optional<String> nutVariable() {
        return Optional.ofNullable(nutVariable);
    }

    public String displayName() {
        return displayName;
    }

    public Optional<String> unit() {
        return Optional.ofNullable(unit);
    }

    public Optional<String> deviceClass() {
        return Optional.ofNullable(deviceClass);
    }

    public Optional<String> stateClass() {
        return Optional.ofNullable(stateClass);
    }

    public Optional<String> icon() {
        return Optional.ofNullable(icon);
    }

    /**
     * @return true if the field has a column in the metrics table
     */
    public boolean persisted() {
        return persisted;
    }

    public boolean isBinary() {
        return type == FieldType.FLAG;
    }
}
