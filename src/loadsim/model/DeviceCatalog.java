package loadsim.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Список устройств сообщества вместе с их профилями использования.
 * <p>
 * Строится один раз при старте и дальше только читается,
 * поэтому может свободно разделяться между потоками.
 */
public final class DeviceCatalog {

    private final Map<String, Device> devices;
    private final Map<String, UtilizationProfile> profiles;

    private DeviceCatalog(Map<String, Device> devices, Map<String, UtilizationProfile> profiles) {
        this.devices = devices;
        this.profiles = profiles;
    }

    /** Имена устройств в порядке списка. */
    public List<String> getDeviceList() {
        return Collections.unmodifiableList(new ArrayList<>(devices.keySet()));
    }

    public List<Device> getDevices() {
        return Collections.unmodifiableList(new ArrayList<>(devices.values()));
    }

    public Device getDevice(String name) {
        Device d = devices.get(name);
        if (d == null) {
            throw new InputDataException("Unknown device: " + name);
        }
        return d;
    }

    public UtilizationProfile getProfile(String name) {
        UtilizationProfile p = profiles.get(name);
        if (p == null) {
            throw new InputDataException("No utilization profile for device: " + name);
        }
        return p;
    }

    public double getUtilization(String name, int hour, int month) {
        return getProfile(name).getProbability(hour, month);
    }

    public int size() {
        return devices.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder для DeviceCatalog. Проверка согласованности в build().
     */
    public static final class Builder {

        private final Map<String, Device> devices = new LinkedHashMap<>();
        private final Map<String, UtilizationProfile> profiles = new LinkedHashMap<>();

        private Builder() {}

        public Builder addDevice(Device device) {
            if (devices.putIfAbsent(device.getName(), device) != null) {
                throw new InputDataException("Duplicate device: " + device.getName());
            }
            return this;
        }

        public Builder addDevice(Device device, UtilizationProfile profile) {
            addDevice(device);
            return setProfile(device.getName(), profile);
        }

        public Builder setProfile(String deviceName, UtilizationProfile profile) {
            profiles.put(deviceName, profile);
            return this;
        }

        public DeviceCatalog build() {
            for (String name : devices.keySet()) {
                if (profiles.get(name) == null) {
                    throw new InputDataException("No utilization profile for device: " + name);
                }
            }
            Map<String, UtilizationProfile> used = new LinkedHashMap<>();
            for (String name : devices.keySet()) {
                used.put(name, profiles.get(name));
            }
            return new DeviceCatalog(new LinkedHashMap<>(devices), used);
        }
    }
}
