package org.regram.compiler.frontend.expander;

import org.regram.compiler.CompilerLimits;
import org.regram.compiler.api.CompiledMacro;
import org.regram.compiler.api.InternalExpansionInvariantError;
import org.regram.compiler.api.ResourceLimitExceededException;
import org.regram.compiler.api.Visibility;
import org.regram.compiler.diagnostics.DiagnosticsEngine;
import org.regram.compiler.frontend.comments.CommentStripper;
import org.regram.compiler.frontend.dependency.DependencyGraph;
import org.regram.compiler.frontend.dependency.DependencyResolver;
import org.regram.compiler.frontend.dependency.MacroBody;
import org.regram.compiler.frontend.parser.DefinitionParser;
import org.regram.compiler.frontend.parser.MacroTable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests reference substitution in definition order.
 */
public class ExpanderTest {

    private static final CompilerLimits LIMITS = new CompilerLimits(1000, 100_000, 10_000);

    private MacroTable table;

    private List<CompiledMacro> expand(String grammar, CompilerLimits limits) throws Exception {
        table = new DefinitionParser("test.grammar", limits).parse(new CommentStripper("test.grammar").strip(grammar));
        DependencyGraph graph = new DependencyResolver("test.grammar", new DiagnosticsEngine()).resolve(table);
        return new Expander("test.grammar", limits).expand(table, graph);
    }

    @Test
    @Tag("unit")
    void compositionIsVerbatimConcatenation() throws Exception {
        List<CompiledMacro> macros = expand("$(!A)=foo\n$(B)=$(A)bar", LIMITS);

        assertThat(macros).containsExactly(
                new CompiledMacro("A", Visibility.INTERNAL, 1, "foo"),
                new CompiledMacro("B", Visibility.PUBLIC, 2, "foobar"));
    }

    @Test
    @Tag("unit")
    void substitutionAddsNoGrouping() throws Exception {
        List<CompiledMacro> macros = expand("$(!alt)=a|b\n$(seq)=x$(alt)y", LIMITS);

        assertThat(macros.get(1).expandedBody()).isEqualTo("xa|by");
    }

    @Test
    @Tag("unit")
    void transitiveReferencesAreFullyExpanded() throws Exception {
        List<CompiledMacro> macros = expand("$(a)=1\n$(b)=$(a)2$(a)\n$(c)=[$(b)]$(b)", LIMITS);

        assertThat(macros).extracting(CompiledMacro::expandedBody).containsExactly("1", "121", "[121]121");
        assertThat(macros).noneMatch(m -> m.expandedBody().contains("$("));
    }

    @Test
    @Tag("unit")
    void expansionIsDeterministic() throws Exception {
        String grammar = "$(!d)=[0-9]\n$(n)=$(d)+(?:\\.$(d)+)?\n$(pair)=$(n),$(n)";

        assertThat(expand(grammar, LIMITS)).isEqualTo(expand(grammar, LIMITS));
    }

    @Test
    @Tag("unit")
    void doublingChainHitsExpandedLengthLimit() {
        StringBuilder grammar = new StringBuilder("$(m0)=ab\n");
        for (int i = 1; i <= 20; i++) {
            grammar.append("$(m").append(i).append(")=$(m").append(i - 1).append(")$(m").append(i - 1).append(")\n");
        }

        assertThatThrownBy(() -> expand(grammar.toString(), LIMITS))
                .isInstanceOfSatisfying(ResourceLimitExceededException.class, e -> {
                    assertThat(e.getLimitName()).isEqualTo("max-expanded-length");
                    // 2 * 2^13 = 16384 is the first length above 10000
                    assertThat(e.getMacroName()).isEqualTo("m13");
                });
    }

    @Test
    @Tag("unit")
    void referenceToUnexpandedMacroIsInternalError() throws Exception {
        expand("$(a)=x\n$(b)=y", LIMITS);
        DependencyGraph corrupted = new DependencyGraph(
                List.of(new MacroBody(0, List.of(MacroBody.Segment.reference("b", 1))),
                        new MacroBody(1, List.of(MacroBody.Segment.literal("y")))),
                List.of());

        assertThatThrownBy(() -> new Expander("test.grammar", LIMITS).expand(table, corrupted))
                .isInstanceOf(InternalExpansionInvariantError.class);
    }

    @Test
    @Tag("unit")
    void dollarAndGroupFromAdjacentMacrosAreNotAReference() throws Exception {
        List<CompiledMacro> macros = expand("$(A)=x\n$(!D)=y$\n$(!P)=(A)\n$(Z)=$(D)$(P)", LIMITS);

        assertThat(macros.get(3).expandedBody()).isEqualTo("y$(A)");
    }

    @Test
    @Tag("unit")
    void referenceLeftInLiteralTextIsInternalError() throws Exception {
        expand("$(a)=x\n$(b)=y", LIMITS);
        DependencyGraph corrupted = new DependencyGraph(
                List.of(new MacroBody(0, List.of(MacroBody.Segment.literal("x"))),
                        new MacroBody(1, List.of(MacroBody.Segment.literal("y$(a)")))),
                List.of());

        assertThatThrownBy(() -> new Expander("test.grammar", LIMITS).expand(table, corrupted))
                .isInstanceOf(InternalExpansionInvariantError.class)
                .hasMessageContaining("'a'");
    }
}
