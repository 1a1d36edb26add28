package com.nevis.citation.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.citation.config.CitationProperties;
import com.nevis.citation.exception.InvalidElementException;
import com.nevis.citation.exception.ReferenceUnavailableException;
import com.nevis.citation.infra.RateLimiter;
import com.nevis.citation.model.CitationLocation;
import com.nevis.citation.model.CitationMatch;
import com.nevis.citation.model.ClaimElement;
import com.nevis.citation.model.LocationSnippet;
import com.nevis.citation.model.ReferenceDocument;
import com.nevis.citation.model.ReferenceSection;
import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.document.splitter.DocumentSplitters;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.store.embedding.CosineSimilarity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

@Service
@Slf4j
public class ReferenceMatcherImpl implements ReferenceMatcher {

    public static final String CHAT_LIMIT = "chat_limit";
    public static final String EMBEDDING_LIMIT = "embedding_limit";

    private static final String MATCH_PROMPT_TEMPLATE =
        """
            Role: Patent examiner comparing one claim element against a prior-art reference.

            Task: Decide whether the passages below disclose the claim element.

            Claim element:
            %s

            Reference %s passages (each prefixed by its index):
            %s

            Output: a single JSON object and nothing else:
            {"score": <0.0-1.0, how completely the passages disclose the element>,
             "reasoning": "<one or two sentences>",
             "matching_text": "<verbatim text from the passages that discloses the element, or empty>",
             "passages": [<indexes of the passages that support the match>]}
            Use score 0 and an empty passages list when the element is not disclosed.
            """;

    record Passage(int index, String section, String text) {}

    record MatchVerdict(
        Double score,
        String reasoning,
        @JsonProperty("matching_text") String matchingText,
        List<Integer> passages
    ) {}

    private final ChatModel chatModel;
    private final EmbeddingModel embeddingModel;
    private final RateLimiter chatLimiter;
    private final RateLimiter embeddingLimiter;
    private final ModelResponseParser parser;
    private final DocumentSplitter splitter;
    private final int candidatePassages;
    private final int maxPassageChars;

    public ReferenceMatcherImpl(
        ChatModel chatModel,
        EmbeddingModel embeddingModel,
        @Qualifier("chatLimiter") RateLimiter chatLimiter,
        @Qualifier("embeddingLimiter") RateLimiter embeddingLimiter,
        ModelResponseParser parser,
        CitationProperties properties
    ) {
        this.chatModel = chatModel;
        this.embeddingModel = embeddingModel;
        this.chatLimiter = chatLimiter;
        this.embeddingLimiter = embeddingLimiter;
        this.parser = parser;
        this.splitter = DocumentSplitters.recursive(
            properties.matcher().chunkSize(),
            properties.matcher().chunkOverlap()
        );
        this.candidatePassages = properties.matcher().candidatePassages();
        this.maxPassageChars = properties.matcher().maxPassageChars();
    }

    @Override
    public CitationMatch match(ClaimElement element, ReferenceDocument reference) {
        if (element.text() == null || element.text().isBlank()) {
            throw new InvalidElementException(element.id(), "Element text is empty");
        }
        if (!reference.hasReadableText()) {
            throw new ReferenceUnavailableException(reference.referenceNumber(), "document has no readable text");
        }

        String elementText = normalize(element.text());
        List<Passage> passages = split(reference);
        if (passages.isEmpty()) {
            return noMatch(element, reference, elementText, "Reference contains no passages to compare");
        }

        List<Passage> candidates = rankCandidates(elementText, passages);
        log.debug("Element {} vs {}: {} passages, {} candidates",
            element.id(), reference.referenceNumber(), passages.size(), candidates.size());

        String prompt = String.format(MATCH_PROMPT_TEMPLATE, elementText, reference.referenceNumber(), render(candidates));
        String raw = chatLimiter.execute(CHAT_LIMIT, 1, () -> chatModel.chat(prompt));
        MatchVerdict verdict = parser.parse(raw, MatchVerdict.class);

        double score = ModelResponseParser.clamp(verdict.score());
        if (score == 0.0) {
            String reasoning = verdict.reasoning() == null || verdict.reasoning().isBlank()
                ? "Reference does not disclose this element"
                : verdict.reasoning();
            return noMatch(element, reference, elementText, reasoning);
        }

        List<Passage> cited = citedPassages(verdict, candidates);
        return new CitationMatch(
            null,
            null,
            null,
            reference.referenceNumber(),
            element.id(),
            element.text(),
            element.order(),
            elementText,
            verdict.matchingText(),
            score,
            verdict.reasoning(),
            new CitationLocation(reference.referenceNumber(), element.id(), snippets(cited, verdict.matchingText())),
            null,
            null,
            null
        );
    }

    List<Passage> split(ReferenceDocument reference) {
        List<Passage> passages = new ArrayList<>();
        for (ReferenceSection section : reference.sections()) {
            if (section.text() == null || section.text().isBlank()) {
                continue;
            }
            for (TextSegment segment : splitter.split(Document.from(section.text()))) {
                passages.add(new Passage(passages.size(), section.section(), segment.text()));
            }
        }
        return passages;
    }

    private List<Passage> rankCandidates(String elementText, List<Passage> passages) {
        if (passages.size() <= candidatePassages) {
            return passages;
        }

        Embedding query = embeddingLimiter.execute(EMBEDDING_LIMIT, Math.max(1, elementText.length() / 4),
            () -> embeddingModel.embed(elementText).content());
        int estimatedTokens = passages.stream().mapToInt(p -> p.text().length()).sum() / 4;
        Response<List<Embedding>> response = embeddingLimiter.execute(EMBEDDING_LIMIT, Math.max(1, estimatedTokens),
            () -> embeddingModel.embedAll(passages.stream().map(p -> TextSegment.from(p.text())).toList()));

        List<Embedding> vectors = response.content();
        return IntStream.range(0, passages.size())
            .boxed()
            .sorted(Comparator.comparingDouble((Integer i) -> CosineSimilarity.between(query, vectors.get(i))).reversed())
            .limit(candidatePassages)
            .map(passages::get)
            .sorted(Comparator.comparingInt(Passage::index))
            .toList();
    }

    private String render(List<Passage> candidates) {
        return candidates.stream()
            .map(p -> "[" + p.index() + "] (" + p.section() + ") " + truncate(p.text()))
            .collect(Collectors.joining("\n\n"));
    }

    private List<Passage> citedPassages(MatchVerdict verdict, List<Passage> candidates) {
        List<Integer> indexes = verdict.passages() == null ? List.of() : verdict.passages();
        List<Passage> cited = candidates.stream()
            .filter(p -> indexes.contains(p.index()))
            .sorted(Comparator.comparingInt(Passage::index))
            .toList();
        if (!cited.isEmpty()) {
            return cited;
        }
        // model scored a match without citing a valid passage: fall back to the passage holding the quote
        String quote = verdict.matchingText();
        return candidates.stream()
            .filter(p -> quote != null && !quote.isBlank() && p.text().contains(quote))
            .findFirst()
            .or(() -> candidates.stream().findFirst())
            .map(List::of)
            .orElse(List.of());
    }

    private List<LocationSnippet> snippets(List<Passage> cited, String matchingText) {
        return cited.stream()
            .map(p -> {
                boolean quoted = matchingText != null && !matchingText.isBlank() && p.text().contains(matchingText);
                return new LocationSnippet(p.section(), quoted ? matchingText : truncate(p.text()), truncate(p.text()));
            })
            .toList();
    }

    private CitationMatch noMatch(ClaimElement element, ReferenceDocument reference, String elementText, String reasoning) {
        return new CitationMatch(
            null,
            null,
            null,
            reference.referenceNumber(),
            element.id(),
            element.text(),
            element.order(),
            elementText,
            null,
            0.0,
            reasoning,
            null,
            null,
            null,
            null
        );
    }

    private String truncate(String text) {
        return text.length() <= maxPassageChars ? text : text.substring(0, maxPassageChars);
    }

    static String normalize(String text) {
        return Objects.requireNonNull(text).strip().replaceAll("\\s+", " ");
    }
}
