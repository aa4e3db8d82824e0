package edu.isi.corrigo;
/** a correction parse ended without an accepting item. Since insertion can supply
    any terminal this only happens when grammar validation let something through */
public class NoDerivationException extends GrammarException {
    /**          Constructs a new exception with null as its detail message. */
    public NoDerivationException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public NoDerivationException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public NoDerivationException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public NoDerivationException(Throwable cause) { super(cause); } 
}
