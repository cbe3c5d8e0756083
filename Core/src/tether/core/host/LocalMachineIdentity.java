package tether.core.host;

import tether.core.util.Logger;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * The identity of the machine this process runs on.
 *
 * The host name is resolved once, on first use. If the local host cannot be resolved the HOSTNAME or COMPUTERNAME
 * environment variables are consulted, and "localhost" is used as a last resort.
 */
public final class LocalMachineIdentity implements MachineIdentity {
    private static final Logger LOGGER = Logger.forClass(LocalMachineIdentity.class);
    private String computerName;

    @Override
    public synchronized String getComputerName() {
        if (this.computerName == null) {
            this.computerName = resolveComputerName();
        }
        return this.computerName;
    }

    private static String resolveComputerName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            LOGGER.log("Unable to resolve local host name: " + e.getMessage());
        }

        String name = System.getenv("HOSTNAME");
        if (name == null || name.isEmpty()) {
            name = System.getenv("COMPUTERNAME");
        }
        return (name == null || name.isEmpty()) ? "localhost" : name;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { computer name: " + this.computerName + " }";
    }
}
