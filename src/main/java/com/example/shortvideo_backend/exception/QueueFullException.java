package com.example.shortvideo_backend.exception;

public class QueueFullException extends RuntimeException {
    private final int capacity;

    public QueueFullException(int capacity) {
        super("Job queue is full (capacity=" + capacity + ")");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
