package com.wshg.synergy.service;

import com.wshg.synergy.domain.Device;
import com.wshg.synergy.exception.DescriptorBuildException;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 将设备记录转为一句英文描述，作为向量模型的唯一输入：
 * "&lt;设备类型&gt; that &lt;主要动作&gt; in &lt;区域&gt; area[ with &lt;最多 3 个能力&gt;]"。
 * 同一设备多次调用结果逐字节一致，缓存命中依赖这一点。
 */
@Component
public class DeviceDescriptorBuilder {

    static final int MAX_CAPABILITIES = 3;
    static final String UNKNOWN_AREA = "unknown";

    /** Home Assistant device_class -> 友好名称 */
    private static final Map<String, String> CLASS_NAMES = Map.ofEntries(
            Map.entry("motion", "motion sensor"),
            Map.entry("occupancy", "occupancy sensor"),
            Map.entry("presence", "presence sensor"),
            Map.entry("door", "door sensor"),
            Map.entry("window", "window sensor"),
            Map.entry("opening", "opening sensor"),
            Map.entry("garage_door", "garage door sensor"),
            Map.entry("temperature", "temperature sensor"),
            Map.entry("humidity", "humidity sensor"),
            Map.entry("illuminance", "light level sensor"),
            Map.entry("moisture", "leak sensor"),
            Map.entry("smoke", "smoke detector"),
            Map.entry("gas", "gas detector"),
            Map.entry("carbon_monoxide", "carbon monoxide detector"),
            Map.entry("power", "power meter"),
            Map.entry("energy", "energy meter"),
            Map.entry("battery", "battery sensor"),
            Map.entry("vibration", "vibration sensor"),
            Map.entry("sound", "sound sensor"),
            Map.entry("outlet", "smart outlet"),
            Map.entry("blind", "window blind"),
            Map.entry("curtain", "curtain"),
            Map.entry("shade", "window shade"),
            Map.entry("tv", "television"),
            Map.entry("speaker", "speaker")
    );

    /** domain 缺少 device_class 时的通用名称 */
    private static final Map<String, String> DOMAIN_NAMES = Map.ofEntries(
            Map.entry("sensor", "sensor device"),
            Map.entry("binary_sensor", "binary sensor device"),
            Map.entry("light", "light"),
            Map.entry("switch", "switch"),
            Map.entry("climate", "thermostat"),
            Map.entry("lock", "smart lock"),
            Map.entry("cover", "window cover"),
            Map.entry("fan", "fan"),
            Map.entry("media_player", "media player"),
            Map.entry("camera", "camera"),
            Map.entry("alarm_control_panel", "alarm panel"),
            Map.entry("vacuum", "robot vacuum"),
            Map.entry("humidifier", "humidifier"),
            Map.entry("water_heater", "water heater"),
            Map.entry("siren", "siren"),
            Map.entry("button", "button"),
            Map.entry("scene", "scene")
    );

    private static final Map<String, String> DOMAIN_ACTIONS = Map.ofEntries(
            Map.entry("light", "controls lighting"),
            Map.entry("switch", "switches power"),
            Map.entry("climate", "controls temperature"),
            Map.entry("lock", "secures entry"),
            Map.entry("cover", "opens and closes"),
            Map.entry("fan", "controls airflow"),
            Map.entry("media_player", "plays media"),
            Map.entry("camera", "records video"),
            Map.entry("alarm_control_panel", "monitors security"),
            Map.entry("vacuum", "cleans floors"),
            Map.entry("humidifier", "controls humidity"),
            Map.entry("water_heater", "heats water"),
            Map.entry("siren", "sounds alarms"),
            Map.entry("button", "triggers actions"),
            Map.entry("scene", "activates scenes")
    );

    public String build(Device device) {
        if (device == null) {
            throw new DescriptorBuildException("device 不能为空");
        }
        if (device.getDeviceId() == null || device.getDeviceId().isBlank()) {
            throw new DescriptorBuildException("deviceId 为空, domain=" + device.getDomain());
        }
        String domain = normalizeKey(device.getDomain());
        StringBuilder sb = new StringBuilder();
        sb.append(capitalize(friendlyClass(domain, device)))
                .append(" that ")
                .append(primaryAction(domain, device))
                .append(" in ")
                .append(device.area().map(DeviceDescriptorBuilder::words).orElse(UNKNOWN_AREA))
                .append(" area");
        String caps = topCapabilities(device);
        if (!caps.isEmpty()) sb.append(" with ").append(caps);
        return sb.toString();
    }

    private static String friendlyClass(String domain, Device device) {
        if (device.deviceClass().isPresent()) {
            String cls = normalizeKey(device.deviceClass().get());
            String known = CLASS_NAMES.get(cls);
            if (known != null) return known;
            return words(cls) + " " + domainNoun(domain);
        }
        if (domain.isEmpty()) return "device";
        return DOMAIN_NAMES.getOrDefault(domain, words(domain) + " device");
    }

    private static String domainNoun(String domain) {
        if (domain.isEmpty()) return "device";
        if (domain.equals("sensor") || domain.equals("binary_sensor")) return "sensor";
        return words(domain);
    }

    private static String primaryAction(String domain, Device device) {
        String cls = device.deviceClass().map(DeviceDescriptorBuilder::normalizeKey).orElse("");
        if (domain.equals("binary_sensor")) {
            return cls.isEmpty() ? "detects state changes" : "detects " + words(cls);
        }
        if (domain.equals("sensor")) {
            return cls.isEmpty() ? "reports measurements" : "measures " + words(cls);
        }
        String action = DOMAIN_ACTIONS.get(domain);
        if (action != null) return action;
        return domain.isEmpty() ? "reports state" : "controls " + words(domain);
    }

    private static String topCapabilities(Device device) {
        if (device.getCapabilities() == null || device.getCapabilities().isEmpty()) return "";
        return device.getCapabilities().stream()
                .filter(Objects::nonNull)
                .map(DeviceDescriptorBuilder::normalizeKey)
                .filter(c -> !c.isEmpty())
                .distinct()
                .sorted()
                .limit(MAX_CAPABILITIES)
                .map(DeviceDescriptorBuilder::words)
                .collect(Collectors.joining(", "));
    }

    private static String normalizeKey(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    private static String words(String key) {
        return key.trim().toLowerCase(Locale.ROOT).replaceAll("[_\\-\\s]+", " ").trim();
    }

    private static String capitalize(String s) {
        if (s.isEmpty()) return s;
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
