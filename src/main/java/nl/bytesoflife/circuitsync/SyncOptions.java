package nl.bytesoflife.circuitsync;

import nl.bytesoflife.circuitsync.geometry.GridPlacement;
import nl.bytesoflife.circuitsync.geometry.PlacementProvider;
import nl.bytesoflife.circuitsync.kicad.KicadSymbolLibrary;
import nl.bytesoflife.circuitsync.kicad.SymbolLibrary;
import nl.bytesoflife.circuitsync.tool.KicadCli;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Settings for one sync run.
 */
public class SyncOptions {

    private boolean preserveUserComponents;
    private boolean dryRun;
    private boolean strictVerification;
    private boolean erc;
    private String kicadCli = KicadCli.DEFAULT_EXECUTABLE;
    private Duration toolTimeout = KicadCli.DEFAULT_TIMEOUT;
    private SymbolLibrary symbolLibrary;
    private PlacementProvider placement = new GridPlacement();
    private Supplier<String> tokenGenerator = () -> UUID.randomUUID().toString();
    private Clock clock = Clock.systemDefaultZone();

    /**
     * Keep components that exist only in the schematic instead of removing them.
     */
    public SyncOptions withPreserveUserComponents(boolean preserveUserComponents) {
        this.preserveUserComponents = preserveUserComponents;
        return this;
    }

    /**
     * Compute the full result but write nothing.
     */
    public SyncOptions withDryRun(boolean dryRun) {
        this.dryRun = dryRun;
        return this;
    }

    /**
     * Fail instead of warn when the merged schematic does not match the description.
     */
    public SyncOptions withStrictVerification(boolean strictVerification) {
        this.strictVerification = strictVerification;
        return this;
    }

    /**
     * Run the external electrical rule check after writing.
     */
    public SyncOptions withErc(boolean erc) {
        this.erc = erc;
        return this;
    }

    public SyncOptions withKicadCli(String executable) {
        this.kicadCli = executable;
        return this;
    }

    public SyncOptions withToolTimeout(Duration toolTimeout) {
        this.toolTimeout = toolTimeout;
        return this;
    }

    public SyncOptions withSymbolLibrary(SymbolLibrary symbolLibrary) {
        this.symbolLibrary = symbolLibrary;
        return this;
    }

    public SyncOptions withPlacement(PlacementProvider placement) {
        this.placement = placement;
        return this;
    }

    /**
     * Source of identity tokens for new symbols, sheets and files.
     */
    public SyncOptions withTokenGenerator(Supplier<String> tokenGenerator) {
        this.tokenGenerator = tokenGenerator;
        return this;
    }

    /**
     * Clock for the netlist date.
     */
    public SyncOptions withClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public boolean isPreserveUserComponents() {
        return preserveUserComponents;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public boolean isStrictVerification() {
        return strictVerification;
    }

    public boolean isErc() {
        return erc;
    }

    public KicadCli getKicadCli() {
        return new KicadCli(kicadCli, toolTimeout);
    }

    /**
     * The configured library, or the bundled one.
     */
    public SymbolLibrary getSymbolLibrary() {
        if (symbolLibrary == null) {
            symbolLibrary = KicadSymbolLibrary.bundled();
        }
        return symbolLibrary;
    }

    public PlacementProvider getPlacement() {
        return placement;
    }

    public Supplier<String> getTokenGenerator() {
        return tokenGenerator;
    }

    public Clock getClock() {
        return clock;
    }
}
