package tether.core.host;

/**
 * Provides the name of the machine results are reported from.
 */
@FunctionalInterface
public interface MachineIdentity {

    public String getComputerName();
}
