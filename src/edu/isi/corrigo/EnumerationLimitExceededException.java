package edu.isi.corrigo;

import java.util.NoSuchElementException;

/** thrown by an enumerator whose caller-supplied cutoff (depth, cost or frontier size)
    stopped it before the correction set was exhausted. A plain NoSuchElementException
    means there really is nothing left */
public class EnumerationLimitExceededException extends NoSuchElementException {
    private final String limit;
    /**      Constructs a new exception naming the limit that was hit. */
    public EnumerationLimitExceededException(String limit, String message) {
	super(message);
	this.limit = limit;
    }
    /** the name of the cutoff that was reached: depth, cost or frontier */
    public String getLimit() { return limit; }
}
