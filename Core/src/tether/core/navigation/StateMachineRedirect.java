package tether.core.navigation;

/**
 * Follows the async state machine marker of a declared method to the method that holds its real body.
 */
public final class StateMachineRedirect {

    private StateMachineRedirect() {}

    /**
     * Returns the method whose sequence points describe the given declared method.
     *
     * A method without a state machine marker is its own effective method. A marked method is redirected to the
     * {@link AsyncStateMachine#CONTINUATION_METHOD} of its state machine type. Only one level of redirection is
     * applied. Returns null if the state machine type or its continuation method cannot be found in the index.
     *
     * @param typeIndex The index of the assembly.
     * @param declaredMethod The method as declared.
     * @return the effective method, or null.
     */
    public static MethodDefinition effectiveMethod(TypeIndex typeIndex, MethodDefinition declaredMethod) {
        if (typeIndex == null) {
            throw new NullPointerException("typeIndex must be non-null.");
        }
        if (declaredMethod == null) {
            throw new NullPointerException("declaredMethod must be non-null.");
        }
        if (!declaredMethod.isAsyncStateMachine()) {
            return declaredMethod;
        }

        TypeDefinition stateMachine = typeIndex.find(declaredMethod.stateMachineType);
        if (stateMachine == null) {
            return null;
        }
        return stateMachine.findDeclaredMethod(AsyncStateMachine.CONTINUATION_METHOD);
    }
}
