package org.machlink.compiler.frontend.parser;

import org.machlink.compiler.frontend.parser.ast.DefinitionNode;
import org.machlink.compiler.frontend.parser.ast.EdgeNode;
import org.machlink.compiler.frontend.parser.ast.ImportStatement;
import org.machlink.compiler.frontend.parser.ast.ImportedSymbol;
import org.machlink.compiler.frontend.parser.ast.MachineNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@Tag("unit")
class OutlineParserTest {

    private final OutlineParser parser = new OutlineParser();

    @Test
    void parsesTitleImportsDefinitionsAndEdges() throws Exception {
        MachineNode machine = parser.parse("""
                machine "Order Flow"
                import { Start as StartA, Shared.Step } from "./module-a.dygram"
                import { End } from "https://example.com/lib.dygram";

                state Idle "Waiting"
                task Process {
                    prompt: "handle the order"
                    state Inner
                }
                Idle -> Process --> End
                """, "virtual:/app.dygram");

        assertThat(machine.title()).isEqualTo("Order Flow");
        assertThat(machine.imports()).hasSize(2);

        ImportStatement first = machine.imports().get(0);
        assertThat(first.path()).isEqualTo("./module-a.dygram");
        assertThat(first.line()).isEqualTo(2);
        assertThat(first.symbols()).extracting(ImportedSymbol::name).containsExactly("Start", "Shared.Step");
        assertThat(first.symbols()).extracting(ImportedSymbol::effectiveName).containsExactly("StartA", "Step");

        assertThat(machine.definitions()).extracting(DefinitionNode::name).containsExactly("Idle", "Process");
        DefinitionNode idle = machine.definitions().get(0);
        assertThat(idle.type()).isEqualTo("state");
        assertThat(idle.title()).isEqualTo("Waiting");

        DefinitionNode process = machine.definitions().get(1);
        assertThat(process.attributes()).containsEntry("prompt", "handle the order");
        assertThat(process.children()).singleElement().satisfies(inner -> {
            assertThat(inner.qualifiedName()).isEqualTo("Process.Inner");
            assertThat(inner.containerPath()).isEqualTo("Process");
        });

        assertThat(machine.edges()).extracting(EdgeNode::source, EdgeNode::target)
                .containsExactly(
                        tuple("Idle", "Process"),
                        tuple("Process", "End"));
    }

    @Test
    void ignoresComments() throws Exception {
        MachineNode machine = parser.parse("""
                // leading comment
                state A // trailing comment
                state B "has // inside"
                """, "a");

        assertThat(machine.definitions()).extracting(DefinitionNode::name).containsExactly("A", "B");
        assertThat(machine.definitions().get(1).title()).isEqualTo("has // inside");
    }

    @Test
    void bareDefinitionsAndSemicolons() throws Exception {
        MachineNode machine = parser.parse("A; B; C { D }", "a");

        assertThat(machine.definitions()).extracting(DefinitionNode::name).containsExactly("A", "B", "C");
        assertThat(machine.definitions().get(2).children()).extracting(DefinitionNode::name).containsExactly("D");
    }

    @Test
    void arrowsInsideTitlesAreText() throws Exception {
        MachineNode machine = parser.parse("state A \"go -> there\"\nA -> B", "a");

        DefinitionNode definition = machine.definitions().get(0);
        assertThat(definition.type()).isEqualTo("state");
        assertThat(definition.name()).isEqualTo("A");
        assertThat(definition.title()).isEqualTo("go -> there");
        assertThat(machine.edges()).extracting(EdgeNode::source, EdgeNode::target)
                .containsExactly(tuple("A", "B"));
    }

    @Test
    void danglingAsYieldsEmptyAlias() throws Exception {
        MachineNode machine = parser.parse("import { Start as } from \"./a.dygram\"", "a");

        ImportedSymbol symbol = machine.imports().get(0).symbols().get(0);
        assertThat(symbol.alias()).isEmpty();
    }

    @Test
    void emptySymbolListIsParsed() throws Exception {
        MachineNode machine = parser.parse("import { } from \"./a.dygram\"", "a");

        assertThat(machine.imports().get(0).symbols()).isEmpty();
    }

    @Test
    void identifierStartingWithImportIsADefinition() throws Exception {
        MachineNode machine = parser.parse("import_job", "a");

        assertThat(machine.imports()).isEmpty();
        assertThat(machine.definitions()).extracting(DefinitionNode::name).containsExactly("import_job");
    }

    @Test
    void unclosedBlockIsRejected() {
        assertThatThrownBy(() -> parser.parse("task A {\n state B\n", "broken.dygram"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageContaining("Unclosed block")
                .satisfies(e -> {
                    assertThat(((SyntaxException) e).getLine()).isEqualTo(1);
                    assertThat(((SyntaxException) e).getSourceFile()).isEqualTo("broken.dygram");
                });
    }

    @Test
    void childrenFollowSourceOrder() throws Exception {
        MachineNode machine = parser.parse(
                "import { X } from \"./x\"\nGroup {\n state A\n A -> A\n}\nGroup -> Group", "tree.dygram");

        assertThat(machine.getChildren()).hasSize(3);
        assertThat(machine.getChildren().get(0)).isInstanceOf(ImportStatement.class);
        assertThat(machine.getChildren().get(0).getChildren()).singleElement().isInstanceOf(ImportedSymbol.class);
        assertThat(machine.getChildren().get(1).getChildren())
                .hasSize(2)
                .last().isInstanceOf(EdgeNode.class);
        assertThat(machine.getChildren().get(2).getChildren()).isEmpty();
    }

    @Test
    void unbalancedBraceIsRejected() {
        assertThatThrownBy(() -> parser.parse("state A\n}", "broken.dygram"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageContaining("broken.dygram:2");
    }

    @Test
    void importInsideBlockIsRejected() {
        assertThatThrownBy(() -> parser.parse("task A {\nimport { X } from \"./x\"\n}", "a"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageContaining("top level");
    }

    @Test
    void malformedStatementsAreRejected() {
        assertThatThrownBy(() -> parser.parse("A -> ", "a")).isInstanceOf(SyntaxException.class);
        assertThatThrownBy(() -> parser.parse("state \"x", "a")).isInstanceOf(SyntaxException.class);
        assertThatThrownBy(() -> parser.parse("import Start from \"./a\"", "a")).isInstanceOf(SyntaxException.class);
        assertThatThrownBy(() -> parser.parse("a b c d", "a")).isInstanceOf(SyntaxException.class);
    }

    @Test
    void deepCopyDetachesFromOriginal() throws Exception {
        MachineNode machine = parser.parse("Group { Child { Leaf } }", "a");
        DefinitionNode child = machine.definitions().get(0).children().get(0);

        DefinitionNode copy = child.deepCopy("Renamed");

        assertThat(copy).isNotSameAs(child);
        assertThat(copy.containerPath()).isNull();
        assertThat(copy.qualifiedName()).isEqualTo("Renamed");
        assertThat(copy.children().get(0).qualifiedName()).isEqualTo("Renamed.Leaf");
        assertThat(copy.children().get(0)).isNotSameAs(child.children().get(0));
        assertThat(child.qualifiedName()).isEqualTo("Group.Child");
    }
}
