package edu.isi.corrigo;
/** for grammars that can't be compiled: undeclared symbols, missing start symbol,
    nonterminals that can't derive any terminal string */
public class GrammarException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public GrammarException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public GrammarException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public GrammarException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public GrammarException(Throwable cause) { super(cause); } 
}
