// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.extraction;

import ftmlextract.narrative.DocumentCounter;
import ftmlextract.narrative.DocumentStyle;
import ftmlextract.narrative.SectionLevel;
import ftmlextract.uri.DocumentElementUri;
import ftmlextract.uri.DocumentUri;
import ftmlextract.uri.ModuleUri;
import ftmlextract.uri.SymbolUri;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A fact about the document that takes effect immediately, without opening a frame.
 */
public sealed interface MetaDatum {
    record Style(DocumentStyle style) implements MetaDatum {
    }

    record Counter(DocumentCounter counter) implements MetaDatum {
    }

    record InputRef(DocumentElementUri uri, DocumentUri target) implements MetaDatum {
    }

    record IfInputref(boolean value) implements MetaDatum {
    }

    record SetSectionLevel(SectionLevel level) implements MetaDatum {
    }

    record ImportModule(ModuleUri module) implements MetaDatum {
    }

    record UseModule(ModuleUri module) implements MetaDatum {
    }

    record Rename(SymbolUri source, @Nullable String newName, @Nullable String macroname) implements MetaDatum {
    }
}
