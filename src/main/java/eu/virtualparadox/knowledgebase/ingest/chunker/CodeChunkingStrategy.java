package eu.virtualparadox.knowledgebase.ingest.chunker;

import eu.virtualparadox.knowledgebase.ingest.chunker.code.CodeLanguages;
import eu.virtualparadox.knowledgebase.ingest.chunker.code.CodeUnit;
import eu.virtualparadox.knowledgebase.ingest.chunker.code.StructuralParser;
import eu.virtualparadox.knowledgebase.ingest.classifier.DocumentClass;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkDraft;
import eu.virtualparadox.knowledgebase.ingest.model.ChunkMetadata;
import eu.virtualparadox.knowledgebase.ingest.token.TokenCounter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structure-aware chunking of source code.
 * <p>
 * Every top-level declaration becomes a primary chunk tagged with its symbol and node kind.
 * Code between declarations (imports, constants, statements) becomes a secondary chunk, or
 * rides with a neighbouring declaration when it is whitespace or smaller than
 * {@code minTokens}. A declaration larger than {@code maxTokens} is split into its members
 * when it has any ({@code Class.method} symbols), otherwise into token windows.
 * Languages without a parser go to {@link FixedTokenChunkingStrategy}.
 */
@Component
@RequiredArgsConstructor
public class CodeChunkingStrategy implements ChunkingStrategy {

    public static final String NAME = "code-structure";

    private static final String MODULE = "module";

    private final FixedTokenChunkingStrategy fixedTokens;

    @Override
    public DocumentClass documentClass() {
        return DocumentClass.CODE;
    }

    @Override
    public String strategyName() {
        return NAME;
    }

    @Override
    public List<ChunkDraft> chunk(final TextRegion region, final ChunkingProfile profile) {
        if (region.isBlank()) {
            return List.of();
        }
        final String language = CodeLanguages.detect(region.origin(), region.text());
        final Optional<StructuralParser> parser = CodeLanguages.parserFor(language);
        if (parser.isEmpty()) {
            final Map<String, Object> meta = Drafts.meta(FixedTokenChunkingStrategy.NAME);
            meta.put(ChunkMetadata.LANGUAGE, language);
            return fixedTokens.chunk(region, profile, meta);
        }

        final Assembly assembly = new Assembly(region, profile, language, parser.get());
        final List<CodeUnit> units = parser.get().parse(region.source(), region.start(), region.end(), null);
        assembly.level(units, region.start(), region.end(), null);
        return assembly.drafts();
    }

    private static final class Piece {
        private final int start;
        private int end;
        private final Map<String, Object> meta;

        private Piece(final int start, final int end, final Map<String, Object> meta) {
            this.start = start;
            this.end = end;
            this.meta = meta;
        }
    }

    /**
     * Mutable state of one chunking pass: the pieces emitted so far.
     */
    private final class Assembly {

        private final TextRegion region;
        private final String source;
        private final ChunkingProfile profile;
        private final String language;
        private final StructuralParser parser;
        private final List<Piece> pieces = new ArrayList<>();

        private Assembly(final TextRegion region,
                         final ChunkingProfile profile,
                         final String language,
                         final StructuralParser parser) {
            this.region = region;
            this.source = region.source();
            this.profile = profile;
            this.language = language;
            this.parser = parser;
        }

        /**
         * Emits {@code [from, to)}, whose declarations are {@code units}.
         */
        private void level(final List<CodeUnit> units, final int from, final int to, final String parentSymbol) {
            final int firstPiece = pieces.size();
            int cursor = from;
            for (final CodeUnit unit : units) {
                int unitStart = unit.start();
                if (unit.start() > cursor) {
                    if (rides(cursor, unit.start())) {
                        if (pieces.size() > firstPiece) {
                            last().end = unit.start();
                        } else {
                            unitStart = cursor;
                        }
                    } else {
                        between(cursor, unit.start(), parentSymbol);
                    }
                }
                declaration(unit, unitStart, parentSymbol);
                cursor = unit.end();
            }
            if (cursor < to) {
                if (pieces.size() > firstPiece && rides(cursor, to)) {
                    last().end = to;
                } else if (!isBlank(cursor, to)) {
                    between(cursor, to, parentSymbol);
                }
            }
        }

        private void declaration(final CodeUnit unit, final int start, final String parentSymbol) {
            final String symbol = parentSymbol == null ? unit.name() : parentSymbol + "." + unit.name();
            final Map<String, Object> meta = meta(unit.kind(), symbol, true);
            if (TokenCounter.count(source, start, unit.end()) <= profile.maxTokens()) {
                pieces.add(new Piece(start, unit.end(), meta));
                return;
            }
            if (unit.isContainer()) {
                final List<CodeUnit> members = parser.parse(source, unit.bodyStart(), unit.bodyEnd(), unit);
                if (!members.isEmpty()) {
                    level(members, start, unit.end(), symbol);
                    return;
                }
            }
            windows(start, unit.end(), meta);
        }

        private void between(final int start, final int end, final String parentSymbol) {
            final Map<String, Object> meta = meta(MODULE, parentSymbol, false);
            if (TokenCounter.count(source, start, end) <= profile.maxTokens()) {
                pieces.add(new Piece(start, end, meta));
            } else {
                windows(start, end, meta);
            }
        }

        private void windows(final int start, final int end, final Map<String, Object> meta) {
            final TextRegion part = new TextRegion(source, start, end, region.origin());
            for (final ChunkDraft window : fixedTokens.chunk(part, profile, meta)) {
                pieces.add(new Piece(window.startOffset(), window.endOffset(), meta));
            }
        }

        private Map<String, Object> meta(final String kind, final String symbol, final boolean primary) {
            final Map<String, Object> meta = Drafts.meta(NAME);
            meta.put(ChunkMetadata.LANGUAGE, language);
            meta.put(ChunkMetadata.NODE_KIND, kind);
            if (symbol != null) {
                meta.put(ChunkMetadata.SYMBOL, symbol);
            }
            meta.put(ChunkMetadata.PRIMARY, primary);
            return meta;
        }

        /**
         * Whether the span between declarations is too small to stand alone.
         */
        private boolean rides(final int start, final int end) {
            return isBlank(start, end) || TokenCounter.count(source, start, end) < profile.minTokens();
        }

        private boolean isBlank(final int start, final int end) {
            for (int i = start; i < end; i++) {
                if (!Character.isWhitespace(source.charAt(i))) {
                    return false;
                }
            }
            return true;
        }

        private Piece last() {
            return pieces.get(pieces.size() - 1);
        }

        private List<ChunkDraft> drafts() {
            final LineIndex index = new LineIndex(source);
            final List<ChunkDraft> drafts = new ArrayList<>(pieces.size());
            for (final Piece piece : pieces) {
                final Map<String, Object> meta = new LinkedHashMap<>(piece.meta);
                meta.put(ChunkMetadata.START_LINE, index.lineOf(piece.start));
                meta.put(ChunkMetadata.END_LINE, index.lineOf(Math.max(piece.start, piece.end - 1)));
                drafts.add(Drafts.of(source, piece.start, piece.end, meta));
            }
            return drafts;
        }
    }
}
