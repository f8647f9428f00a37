package com.e2eq.streamquery.operation;

import com.e2eq.streamquery.model.OperationKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Collects the output of one execution: a sequence for resolve, filter and map, a single
 * running value for reduce. Confined to the execution thread.
 */
public class ResultAccumulator {

    private final OperationKind kind;
    private final List<Object> values = new ArrayList<>();
    private Object reduced;
    private boolean reducedOnce;

    public ResultAccumulator(OperationKind kind, Object initialValue) {
        this.kind = kind;
        this.reduced = initialValue;
    }

    public OperationKind getKind() {
        return kind;
    }

    void append(Object value) {
        values.add(value);
    }

    Object current() {
        return reduced;
    }

    void replace(Object next) {
        reduced = next;
        reducedOnce = true;
    }

    /**
     * Number of collected results so far. A reduce counts as one once it has folded a document.
     */
    public int size() {
        if (kind == OperationKind.REDUCE) {
            return reducedOnce ? 1 : 0;
        }
        return values.size();
    }

    /**
     * The result sequence. For reduce it holds the final accumulator as its only element.
     */
    public List<Object> finish() {
        if (kind == OperationKind.REDUCE) {
            return new ArrayList<>(Arrays.asList(reduced));
        }
        return new ArrayList<>(values);
    }
}
