package com.largomodo.platelayout.core.annotation;

/**
 * Running plate number for one document. Not thread-safe; one instance per generation request.
 */
public class SequenceCounter {

    private int next;

    public SequenceCounter(int start) {
        this.next = start;
    }

    public int next() {
        return next++;
    }

    public int peek() {
        return next;
    }
}
