package tether.core.config;

import tether.core.convert.TestConverter;
import tether.core.host.MachineIdentity;
import tether.core.log.TestLog;
import tether.core.navigation.NavigationDataProvider;
import tether.core.util.ObjectChecker;

/**
 * The collaborators shared by every assembly of a discovery or execution session.
 */
public final class AdapterContext {
    public final AdapterConfig config;
    public final TestLog testLog;
    public final MachineIdentity machineIdentity;

    private AdapterContext(AdapterConfig config, TestLog testLog, MachineIdentity machineIdentity) {
        ObjectChecker.assertNonNull(config, testLog, machineIdentity);
        this.config = config;
        this.testLog = testLog;
        this.machineIdentity = machineIdentity;
    }

    public static AdapterContext of(AdapterConfig config, TestLog testLog, MachineIdentity machineIdentity) {
        return new AdapterContext(config, testLog, machineIdentity);
    }

    /**
     * Returns a new converter, with a navigator of its own, for the given assembly. Each assembly load gets a new
     * converter; converters are never shared between assemblies.
     *
     * @param sourceAssembly The path of the assembly.
     * @return the converter.
     */
    public TestConverter newConverter(String sourceAssembly) {
        return TestConverter.Builder.newBuilder()
                .testLog(this.testLog)
                .sourceAssembly(sourceAssembly)
                .executorUri(this.config.executorUri)
                .navigator(NavigationDataProvider.forAssembly(sourceAssembly, this.config.sourceRoots))
                .machineIdentity(this.machineIdentity)
                .interactiveHost(this.config.interactiveHost)
                .build();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { config: " + this.config + " }";
    }
}
