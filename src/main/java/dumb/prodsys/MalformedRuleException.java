package dumb.prodsys;

/**
 * Raised at load time for a rule or rule set the engine refuses to run.
 */
public class MalformedRuleException extends IllegalArgumentException {
    public MalformedRuleException(String message) {
        super(message);
    }
}
