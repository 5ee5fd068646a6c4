package com.flatline.runtime.interpreter;

/**
 * 定长数组值
 */
public final class FlatlineArray {

    private final Object[] elements;

    public FlatlineArray(Object[] elements) {
        this.elements = elements;
    }

    public int size() {
        return elements.length;
    }

    public Object get(int index) {
        checkIndex(index);
        return elements[index];
    }

    public void set(int index, Object value) {
        checkIndex(index);
        elements[index] = value;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= elements.length) {
            throw new FlatlineRuntimeException("Index " + index + " out of bounds for length " + elements.length);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < elements.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(Interpreter.stringify(elements[i]));
        }
        return sb.append(']').toString();
    }
}
