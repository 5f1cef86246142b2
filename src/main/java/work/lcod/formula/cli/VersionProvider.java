package work.lcod.formula.cli;

import org.antlr.v4.runtime.RuntimeMetaData;
import picocli.CommandLine;

/**
 * Reports the jar's implementation version and the ANTLR runtime the grammar was generated for.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = CalculateCommand.class.getPackage().getImplementationVersion();
        return new String[] {
            "lcod-formula (java) " + (implementationVersion != null ? implementationVersion : "development"),
            "ANTLR runtime " + RuntimeMetaData.VERSION
        };
    }
}
