package loadsim.config;

/**
 * Недопустимые параметры запуска (испытания, перцентиль, потоки).
 * Бросается до начала любой выборки.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
