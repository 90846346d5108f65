// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.extraction;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The FTML attribute vocabulary. Each key corresponds to exactly one attribute name, {@link #PREFIX} followed by the
 * key's name.
 */
public enum FtmlKey {
    MODULE("module"),
    STRUCTURE("feature-structure"),
    MORPHISM("feature-morphism"),
    ASSIGN("assign"),
    RENAME("rename"),
    SYMDECL("symdecl"),
    VARDEF("vardef"),
    VARSEQ("varseq"),
    SECTION("section"),
    SKIPSECTION("skipsection"),
    SECTIONLEVEL("sectionlevel"),
    DEFINITION("definition"),
    PARAGRAPH("paragraph"),
    ASSERTION("assertion"),
    EXAMPLE("example"),
    PROOF("proof"),
    SUBPROOF("subproof"),
    SLIDE("slide"),
    TITLE("title"),
    DOCTITLE("doctitle"),
    INVISIBLE("invisible"),
    TERM("term"),
    HEAD("head"),
    HEADTERM("headterm"),
    ARG("arg"),
    ARGMODE("argmode"),
    TYPE("type"),
    DEFINIENS("definiens"),
    NOTATION("notation"),
    DEFINIENDUM("definiendum"),
    COMP("comp"),
    VARCOMP("varcomp"),
    MAINCOMP("maincomp"),
    DEFCOMP("defcomp"),
    IMPORT("import"),
    USEMODULE("usemodule"),
    INPUTREF("inputref"),
    IFINPUTREF("ifinputref"),
    STYLE("style"),
    COUNTER("counter"),
    COUNTER_PARENT("counter-parent"),
    ID("id"),
    ROLE("role"),
    ARGS("args"),
    ASSOCTYPE("assoctype"),
    REORDERARGS("reorderargs"),
    MACRONAME("macroname"),
    BIND("bind"),
    NOTATIONID("notationid"),
    NOTATIONFRAGMENT("notationfragment"),
    PRECEDENCE("precedence"),
    ARGPRECS("argprecs"),
    LANGUAGE("language"),
    METATHEORY("metatheory"),
    SIGNATURE("signature"),
    DOMAIN("domain"),
    TOTAL("total"),
    RENAME_TO("to"),
    FORS("fors"),
    STYLES("styles"),
    INLINE("inline");

    /**
     * The prefix shared by all FTML attribute names.
     */
    public static final String PREFIX = "data-ftml-";

    FtmlKey(final String name) {
        this.name = name;
        attributeName = PREFIX + name;
    }

    /**
     * Retrieves the key's name without the prefix, e.g. {@code symdecl}.
     */
    public String keyName() {
        return name;
    }

    /**
     * Retrieves the full attribute name, e.g. {@code data-ftml-symdecl}.
     */
    public String attributeName() {
        return attributeName;
    }

    /**
     * Looks up the key for a full attribute name, returning {@code null} if it isn't an FTML attribute.
     */
    public static @Nullable FtmlKey byAttributeName(final String attributeName) {
        return keysByAttributeName.get(attributeName);
    }

    private static final Map<String, FtmlKey> keysByAttributeName =
        Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(FtmlKey::attributeName, Function.identity()));

    private final String name;
    private final String attributeName;
}
