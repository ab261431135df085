package gcra.core.model;

/**
 * The two observable outcomes of an admission check.
 */
public enum Decision {
    ALLOW,
    REJECT
}
