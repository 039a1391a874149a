package loadsim.model;

/**
 * Тип устройства в сообществе (строка списка устройств).
 */
public final class Device {

    /** Уникальное имя устройства. */
    private final String name;

    /** Мощность одного устройства, Вт. */
    private final double powerW;

    /** Количество устройств в сообществе. */
    private final int ownedCount;

    /** Доступно ли устройство (Available = Y). */
    private final boolean available;

    /** Категория для группировки (Type). */
    private final String type;

    public Device(String name, double powerW, int ownedCount, boolean available, String type) {
        if (name == null || name.isBlank()) {
            throw new InputDataException("Device name must not be empty");
        }
        if (!Double.isFinite(powerW) || powerW < 0.0) {
            throw new InputDataException("Device '" + name + "': power must be >= 0 W, got " + powerW);
        }
        if (ownedCount < 0) {
            throw new InputDataException("Device '" + name + "': owned count must be >= 0, got " + ownedCount);
        }
        this.name = name;
        this.powerW = powerW;
        this.ownedCount = ownedCount;
        this.available = available;
        this.type = (type == null) ? "" : type;
    }

    public String getName() {
        return name;
    }

    public double getPowerW() {
        return powerW;
    }

    public int getOwnedCount() {
        return ownedCount;
    }

    public boolean isAvailable() {
        return available;
    }

    public String getType() {
        return type;
    }

    /**
     * Количество, участвующее в выборке: 0 для недоступного устройства.
     */
    public int getEffectiveCount() {
        return available ? ownedCount : 0;
    }

    @Override
    public String toString() {
        return name + " (" + powerW + " W x" + getEffectiveCount() + ", " + type + ")";
    }
}
