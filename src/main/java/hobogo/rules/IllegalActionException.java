package hobogo.rules;

/**
 * Thrown when an action is applied that the rules do not allow. This is always a
 * caller bug: the search only ever plays enumerated legal actions, and front-ends
 * check {@code isValidMove} first.
 */
public class IllegalActionException extends IllegalStateException {

    public IllegalActionException(String message) {
        super(message);
    }
}
