package edu.isi.corrigo;
/** for grammar text that can't be read: no start symbol line, rule without arrow,
    empty left side */

public class DataFormatException extends Exception {
    /**      Constructs a new exception with the specified detail message. */
    public DataFormatException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public DataFormatException(String message, Throwable cause) { super(message, cause); }
}
