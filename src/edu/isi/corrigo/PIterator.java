package edu.isi.corrigo;

import java.util.Iterator;
import java.util.NoSuchElementException;

// iterator that can look at the next element without consuming it
public interface PIterator<E> extends Iterator<E> {
	public E peek() throws NoSuchElementException;
}
