package tether.core.navigation;

import java.util.Collections;
import java.util.List;

/**
 * A method as declared in compiled metadata.
 *
 * {@link MethodDefinition#name}: the simple method name.
 * {@link MethodDefinition#isBridge}: whether the method is a compiler-generated bridge.
 * {@link MethodDefinition#stateMachineType}: the binary name of the async state machine this method is compiled
 * into, or null when the method carries no state machine marker.
 * {@link MethodDefinition#sequencePoints}: the method's sequence points in instruction order; empty when the
 * method has no body or no line information.
 */
public final class MethodDefinition {
    public final String name;
    public final boolean isBridge;
    public final String stateMachineType;
    public final List<SequencePoint> sequencePoints;

    private MethodDefinition(String name, boolean isBridge, String stateMachineType, List<SequencePoint> sequencePoints) {
        if (name == null) {
            throw new NullPointerException("name must be non-null.");
        }
        if (sequencePoints == null) {
            throw new NullPointerException("sequencePoints must be non-null.");
        }
        this.name = name;
        this.isBridge = isBridge;
        this.stateMachineType = stateMachineType;
        this.sequencePoints = Collections.unmodifiableList(sequencePoints);
    }

    public static MethodDefinition method(String name, List<SequencePoint> sequencePoints) {
        return new MethodDefinition(name, false, null, sequencePoints);
    }

    public static MethodDefinition bridge(String name, List<SequencePoint> sequencePoints) {
        return new MethodDefinition(name, true, null, sequencePoints);
    }

    public static MethodDefinition asyncMethod(String name, String stateMachineType, List<SequencePoint> sequencePoints) {
        if (stateMachineType == null) {
            throw new NullPointerException("stateMachineType must be non-null.");
        }
        return new MethodDefinition(name, false, stateMachineType, sequencePoints);
    }

    public boolean isAsyncStateMachine() {
        return this.stateMachineType != null;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { name: " + this.name + (this.isBridge ? ", [bridge]" : "") + (isAsyncStateMachine() ? ", state machine: " + this.stateMachineType : "") + ", sequence points: " + this.sequencePoints.size() + " }";
    }
}
