package io.colabel.cli.commands;

import io.colabel.core.naming.NameTransformer;
import java.util.List;
import java.util.Map;
import picocli.CommandLine;

/// CLI command that prints the display name of each identifier, one per line.
///
/// ### Usage
/// ```bash
/// colabel names 'SUM(sell_in)' anio_id [--label sell_in=Ventas]
/// ```
@CommandLine.Command(name = "names", description = "Show display names of identifiers")
class NamesCommand extends ColabelCommand {

    @CommandLine.Parameters(arity = "1..*", description = "Identifiers, e.g. SUM(sell_in)")
    private List<String> identifiers;

    @CommandLine.Option(
            names = {"--label"},
            description = "Extra or overriding table entry, e.g. sell_in=Ventas")
    private Map<String, String> labels;

    @Override
    protected int execute() {
        NameTransformer nameTransformer =
                labels != null
                        ? NameTransformer.defaults().withLabels(labels)
                        : NameTransformer.defaults();
        for (String identifier : identifiers) {
            System.out.println(identifier + " -> " + nameTransformer.transform(identifier));
        }
        return SUCCESS;
    }
}
