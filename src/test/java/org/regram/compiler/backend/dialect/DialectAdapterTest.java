package org.regram.compiler.backend.dialect;

import org.regram.compiler.api.AdaptOptions;
import org.regram.compiler.api.CaptureGroup;
import org.regram.compiler.api.DialectProfile;
import org.regram.compiler.api.DuplicateGroupNameException;
import org.regram.compiler.api.GrammarErrorCode;
import org.regram.compiler.api.UnsupportedConstructException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the rewrites applied to reconcile a pattern with the capabilities of a regex engine.
 */
public class DialectAdapterTest {

    private static final DialectProfile JAVA = DialectProfile.builder().namedCaptureSupport(true).build();
    private static final DialectProfile LEGACY = DialectProfile.builder().build();
    private static final DialectProfile DOTNET = DialectProfile.builder()
            .namedCaptureSupport(true)
            .duplicateNamedGroupsAllowed(true)
            .variableLengthLookbehindSupport(true)
            .build();
    private static final DialectProfile DOTNET_EXPLICIT = DialectProfile.builder()
            .namedCaptureSupport(true)
            .duplicateNamedGroupsAllowed(true)
            .variableLengthLookbehindSupport(true)
            .explicitCaptureOnly(true)
            .build();

    private static final AdaptOptions NON_CAPTURING_NAMES = new AdaptOptions(true, false);
    private static final AdaptOptions DISAMBIGUATE = new AdaptOptions(false, true);

    private final DialectAdapter adapter = new DialectAdapter();

    @Test
    @Tag("unit")
    void namedGroupsAreKeptWhenSupported() throws Exception {
        AdaptedPattern adapted = adapter.adapt("date", "(?<year>\\d{4})-(?<m>\\d\\d)", JAVA, AdaptOptions.DEFAULTS);

        assertThat(adapted.text()).isEqualTo("(?<year>\\d{4})-(?<m>\\d\\d)");
        assertThat(adapted.groupNameToIndex()).isEqualTo(Map.of("year", 1, "m", 2));
    }

    @Test
    @Tag("unit")
    void namedGroupBecomesPlainGroupMappedToOrdinal() throws Exception {
        AdaptedPattern adapted = adapter.adapt("M", "(a)(?<G>b)", LEGACY, AdaptOptions.DEFAULTS);

        assertThat(adapted.text()).isEqualTo("(a)(b)");
        assertThat(adapted.groupNameToIndex()).isEqualTo(Map.of("G", 2));
        assertThat(adapted.captureGroups()).containsExactly(new CaptureGroup(1, null, 0), new CaptureGroup(2, "G", 3));
    }

    @Test
    @Tag("unit")
    void allNamedGroupSpellingsAreRewritten() throws Exception {
        AdaptedPattern adapted = adapter.adapt("M", "(?<a>1)(?P<b>2)(?'c'3)", LEGACY, AdaptOptions.DEFAULTS);

        assertThat(adapted.text()).isEqualTo("(1)(2)(3)");
        assertThat(adapted.groupNameToIndex()).isEqualTo(Map.of("a", 1, "b", 2, "c", 3));
    }

    @Test
    @Tag("unit")
    void namedGroupsCanBecomeNonCapturing() throws Exception {
        AdaptedPattern adapted = adapter.adapt("M", "(a)(?<G>b)", LEGACY, NON_CAPTURING_NAMES);

        assertThat(adapted.text()).isEqualTo("(a)(?:b)");
        assertThat(adapted.groupNameToIndex()).isEmpty();
        assertThat(adapted.captureGroups()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void nonCapturingNamesOptionIsIgnoredWhenNamesAreSupported() throws Exception {
        AdaptedPattern adapted = adapter.adapt("M", "(?<G>b)", JAVA, NON_CAPTURING_NAMES);

        assertThat(adapted.text()).isEqualTo("(?<G>b)");
    }

    @Test
    @Tag("unit")
    void explicitCaptureTurnsUnnamedGroupsNonCapturing() throws Exception {
        AdaptedPattern adapted = adapter.adapt("M", "(a)(?<G>b)(c)", DOTNET_EXPLICIT, AdaptOptions.DEFAULTS);

        assertThat(adapted.text()).isEqualTo("(?:a)(?<G>b)(?:c)");
        assertThat(adapted.groupNameToIndex()).isEqualTo(Map.of("G", 1));
        assertThat(adapted.captureGroups()).containsExactly(new CaptureGroup(1, "G", 5));
    }

    @Test
    @Tag("unit")
    void explicitCaptureWithoutNamedCapturesCannotKeepNamedGroups() {
        DialectProfile profile = DialectProfile.builder().explicitCaptureOnly(true).build();

        assertThatThrownBy(() -> adapter.adapt("M", "(?<G>b)", profile, AdaptOptions.DEFAULTS))
                .isInstanceOf(UnsupportedConstructException.class);
    }

    @Test
    @Tag("unit")
    void duplicateGroupNameIsReportedWithOffsets() {
        assertThatThrownBy(() -> adapter.adapt("pair", "(?<G>a)|(?<G>b)", JAVA, AdaptOptions.DEFAULTS))
                .isInstanceOfSatisfying(DuplicateGroupNameException.class, e -> {
                    assertThat(e.getGroupName()).isEqualTo("G");
                    assertThat(e.getOffsets()).containsExactly(0, 8);
                    assertThat(e.getMacroName()).isEqualTo("pair");
                    assertThat(e.getCode()).isEqualTo(GrammarErrorCode.DUPLICATE_GROUP_NAME);
                });
    }

    @Test
    @Tag("unit")
    void duplicateOffsetsReferToAdaptedText() {
        assertThatThrownBy(() -> adapter.adapt("pair", "(?<G>a)(?<G>b)", LEGACY, AdaptOptions.DEFAULTS))
                .isInstanceOfSatisfying(DuplicateGroupNameException.class,
                        e -> assertThat(e.getOffsets()).containsExactly(0, 3));
    }

    @Test
    @Tag("unit")
    void duplicatesAreKeptWhenAllowed() throws Exception {
        AdaptedPattern adapted = adapter.adapt("pair", "(?<G>a)|(?<G>b)", DOTNET, AdaptOptions.DEFAULTS);

        assertThat(adapted.text()).isEqualTo("(?<G>a)|(?<G>b)");
        assertThat(adapted.groupNameToIndex()).isEqualTo(Map.of("G", 1));
        assertThat(adapted.captureGroups()).extracting(CaptureGroup::name).containsExactly("G", "G");
    }

    @Test
    @Tag("unit")
    void disambiguationSkipsNamesInUse() throws Exception {
        AdaptedPattern adapted = adapter.adapt("M", "(?<G>a)(?<G>b)(?<G2>c)(?P<G>d)", JAVA, DISAMBIGUATE);

        assertThat(adapted.text()).isEqualTo("(?<G>a)(?<G3>b)(?<G2>c)(?P<G4>d)");
        assertThat(adapted.groupNameToIndex()).isEqualTo(Map.of("G", 1, "G3", 2, "G2", 3, "G4", 4));
    }

    @Test
    @Tag("unit")
    void disambiguationRenamesIndexKeysWithoutNamedCaptures() throws Exception {
        AdaptedPattern adapted = adapter.adapt("M", "(?<G>a)(?<G>b)", LEGACY, DISAMBIGUATE);

        assertThat(adapted.text()).isEqualTo("(a)(b)");
        assertThat(adapted.groupNameToIndex()).isEqualTo(Map.of("G", 1, "G2", 2));
    }

    @Test
    @Tag("unit")
    void fixedLengthLookbehindIsAccepted() throws Exception {
        for (String pattern : List.of("(?<=ab)c", "(?<!a{2})b", "(?<=[*+?])b", "(?<=\\*\\?)b", "(?<=a|bc)d",
                "(?<=a{3,3})b", "(?<=\\Qa+\\E)b", "(?<=(?:ab))c")) {
            assertThat(adapter.adapt("M", pattern, JAVA, AdaptOptions.DEFAULTS).text()).isEqualTo(pattern);
        }
    }

    @Test
    @Tag("unit")
    void variableLengthLookbehindIsRejected() {
        assertThatThrownBy(() -> adapter.adapt("M", "x(?<!a{1,3})y", JAVA, AdaptOptions.DEFAULTS))
                .isInstanceOfSatisfying(UnsupportedConstructException.class, e -> {
                    assertThat(e.getConstruct()).isEqualTo("(?<!a{1,3})");
                    assertThat(e.getOffset()).isEqualTo(1);
                    assertThat(e.getCode()).isEqualTo(GrammarErrorCode.UNSUPPORTED_CONSTRUCT);
                });
        for (String pattern : List.of("(?<=a+)c", "(?<=a*)c", "(?<=(?:ab)?)c", "(?<=a{2,})c", "(?<=\\d+)c")) {
            assertThatThrownBy(() -> adapter.adapt("M", pattern, JAVA, AdaptOptions.DEFAULTS))
                    .as(pattern)
                    .isInstanceOf(UnsupportedConstructException.class);
        }
    }

    @Test
    @Tag("unit")
    void variableLengthLookbehindIsKeptWhenSupported() throws Exception {
        assertThat(adapter.adapt("M", "(?<=a+)c", DOTNET, AdaptOptions.DEFAULTS).text()).isEqualTo("(?<=a+)c");
    }

    @Test
    @Tag("unit")
    void unbalancedPatternIsUnsupported() {
        assertThatThrownBy(() -> adapter.adapt("M", "ab(c", JAVA, AdaptOptions.DEFAULTS))
                .isInstanceOfSatisfying(UnsupportedConstructException.class,
                        e -> assertThat(e.getOffset()).isEqualTo(2));
    }

    @Test
    @Tag("unit")
    void numberedBackreferenceFollowsItsGroup() throws Exception {
        AdaptedPattern adapted = adapter.adapt("M", "(a)(?<n>b)\\2", DOTNET_EXPLICIT, AdaptOptions.DEFAULTS);

        assertThat(adapted.text()).isEqualTo("(?:a)(?<n>b)\\1");
    }

    @Test
    @Tag("unit")
    void backreferenceToRemovedCaptureIsUnsupported() {
        assertThatThrownBy(() -> adapter.adapt("M", "(a)\\1", DOTNET_EXPLICIT, AdaptOptions.DEFAULTS))
                .isInstanceOf(UnsupportedConstructException.class);
    }

    @Test
    @Tag("unit")
    void namedBackreferenceBecomesNumbered() throws Exception {
        AdaptedPattern adapted = adapter.adapt("M", "(?<q>['\"])x\\k<q>", LEGACY, AdaptOptions.DEFAULTS);

        assertThat(adapted.text()).isEqualTo("(['\"])x\\1");
    }

    @Test
    @Tag("unit")
    void numberedBackreferenceBeforeDigitIsWrapped() throws Exception {
        AdaptedPattern adapted = adapter.adapt("M", "(a)(?<n>b)(?P=n)0", LEGACY, AdaptOptions.DEFAULTS);

        assertThat(adapted.text()).isEqualTo("(a)(b)(?:\\2)0");
    }

    @Test
    @Tag("unit")
    void variableLengthOffsetPointsAtQuantifier() {
        assertThat(DialectAdapter.variableLengthOffset("ab?c", 0, 4)).isEqualTo(2);
        assertThat(DialectAdapter.variableLengthOffset("a{2}?b", 0, 6)).isEqualTo(-1);
        assertThat(DialectAdapter.variableLengthOffset("a{,2}", 0, 5)).isEqualTo(1);
        assertThat(DialectAdapter.variableLengthOffset("{x}", 0, 3)).isEqualTo(-1);
    }

    @Test
    @Tag("unit")
    void oversizedBackreferenceIsKeptVerbatim() throws Exception {
        assertThat(adapter.adapt("a", "(x)\\99999999999", DOTNET, AdaptOptions.DEFAULTS).text())
                .isEqualTo("(x)\\99999999999");
        assertThat(adapter.adapt("a", "(?<n>x)\\99999999999", LEGACY, AdaptOptions.DEFAULTS).text())
                .isEqualTo("(x)\\99999999999");
    }

    @Test
    @Tag("unit")
    void oversizedRepeatCountInLookbehindIsVariableLength() {
        for (String pattern : List.of("(?<=x{99999999999})y", "(?<=x{2147483648,2147483648})y")) {
            assertThatThrownBy(() -> adapter.adapt("a", pattern, JAVA, AdaptOptions.DEFAULTS))
                    .as(pattern)
                    .isInstanceOfSatisfying(UnsupportedConstructException.class,
                            e -> assertThat(e.getOffset()).isZero());
        }
        assertThat(DialectAdapter.variableLengthOffset("x{123456789}", 0, 12)).isEqualTo(-1);
    }

    @Test
    @Tag("unit")
    void verbsKeepTheirSpellingAndDoNotShiftGroupNumbers() throws Exception {
        AdaptedPattern explicit = adapter.adapt("M", "(*UCP)(a)(?<n>b)", DOTNET_EXPLICIT, AdaptOptions.DEFAULTS);
        assertThat(explicit.text()).isEqualTo("(*UCP)(?:a)(?<n>b)");
        assertThat(explicit.groupNameToIndex()).isEqualTo(Map.of("n", 1));

        AdaptedPattern legacy = adapter.adapt("M", "(*UCP)(a)\\1", LEGACY, AdaptOptions.DEFAULTS);
        assertThat(legacy.text()).isEqualTo("(*UCP)(a)\\1");
        assertThat(legacy.captureGroups()).containsExactly(new CaptureGroup(1, null, 6));
    }
}
