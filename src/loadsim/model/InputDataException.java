package loadsim.model;

/**
 * Ошибка входных данных: отрицательное количество, вероятность вне [0;1],
 * отсутствующий профиль и т.п. Бросается до начала симуляции, значения не "подрезаются".
 */
public class InputDataException extends RuntimeException {

    public InputDataException(String message) {
        super(message);
    }

    public InputDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
