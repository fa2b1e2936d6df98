package com.dcruver.litsync.nlp;

import com.dcruver.litsync.extract.ImageBlob;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Summarizes papers with an Ollama model through Spring AI.
 * <p>
 * The model is asked for a JSON object; the answer is parsed with Jackson. Failures are
 * classified for {@link RateLimitedCaller}: 429 answers are rate limits, 4xx answers and
 * unparsable output are permanent, everything else is transient.
 */
@Slf4j
public class OllamaSummarizer implements Summarizer {

    private static final String PROMPT_VERSION = "v1";

    private static final String SYSTEM_PROMPT = """
        You are a research assistant writing literature notes for academic papers.
        Read the paper text and answer with a single JSON object, no markdown fences, with these fields:
        {
          "short_summary": "2-3 sentence overview",
          "long_summary": "detailed summary of problem, method, results (3-5 paragraphs)",
          "contribution": "main contributions as a bulleted list",
          "limitations": "limitations and open problems",
          "ideas": "follow-up research ideas",
          "keywords": ["5 to 8 short keywords"]
        }
        Write every text field in %s. Return ONLY the JSON.
        """;

    // Spring AI reports HTTP errors as "<status> - <body>"
    private static final Pattern RATE_LIMIT_STATUS =
        Pattern.compile("(?:^\\s*|\\bHTTP(?:/[\\d.]+)?\\s+|\\bstatus(?:\\s+code)?\\s*[:=]?\\s*)429(?!\\d)",
            Pattern.CASE_INSENSITIVE);

    private final ChatModel chatModel;
    private final String modelName;
    private final int maxTextLength;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OllamaSummarizer(ChatModel chatModel, String modelName, int maxTextLength) {
        this.chatModel = chatModel;
        this.modelName = modelName;
        this.maxTextLength = maxTextLength;
        log.info("OllamaSummarizer initialized with model: {}", modelName);
    }

    @Override
    public String cacheNamespace() {
        return "summary:" + modelName + ":" + PROMPT_VERSION;
    }

    @Override
    public SummaryResponse call(SummaryRequest request) throws ExternalCallException {
        String language = request.getLanguageHint() != null ? request.getLanguageHint() : "English";

        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(String.format(SYSTEM_PROMPT, language)));
        messages.add(new UserMessage(buildUserMessage(request)));

        String answer;
        try {
            ChatResponse response = chatModel.call(new Prompt(messages));
            if (response == null || response.getResults().isEmpty()) {
                throw new ExternalCallException(ExternalCallException.Kind.TRANSIENT, "empty response from model");
            }
            answer = response.getResult().getOutput().getText();
        } catch (RuntimeException e) {
            throw classify(e);
        }

        return parse(answer);
    }

    private String buildUserMessage(SummaryRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("Title: ").append(request.getTitle()).append("\n\n");

        List<ImageBlob> images = request.getImages();
        if (images != null && !images.isEmpty()) {
            sb.append("The paper contains ").append(images.size()).append(" extracted figures on pages ");
            sb.append(String.join(", ", images.stream().map(i -> String.valueOf(i.getPage())).distinct().toList()));
            sb.append(".\n\n");
        }

        sb.append("Paper text:\n");
        sb.append(truncate(request.getText(), maxTextLength));
        return sb.toString();
    }

    ExternalCallException classify(RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        String lower = message.toLowerCase(Locale.ROOT);

        if (httpStatus(e) == 429 || RATE_LIMIT_STATUS.matcher(message).find()
            || lower.contains("rate limit") || lower.contains("too many requests")) {
            return new ExternalCallException(ExternalCallException.Kind.RATE_LIMITED, message, e);
        }
        if (e instanceof NonTransientAiException) {
            return new ExternalCallException(ExternalCallException.Kind.PERMANENT, message, e);
        }
        if (e instanceof TransientAiException || e instanceof ResourceAccessException) {
            return new ExternalCallException(ExternalCallException.Kind.TRANSIENT, message, e);
        }
        log.warn("Unclassified model error, treating as transient: {}", message);
        return new ExternalCallException(ExternalCallException.Kind.TRANSIENT, message, e);
    }

    private static int httpStatus(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof RestClientResponseException) {
                return ((RestClientResponseException) t).getStatusCode().value();
            }
        }
        return -1;
    }

    SummaryResponse parse(String answer) throws ExternalCallException {
        if (answer == null || answer.isBlank()) {
            throw new ExternalCallException(ExternalCallException.Kind.TRANSIENT, "blank answer from model");
        }

        int start = answer.indexOf('{');
        int end = answer.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new ExternalCallException(ExternalCallException.Kind.PERMANENT, "model answer is not JSON");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(answer.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new ExternalCallException(ExternalCallException.Kind.PERMANENT,
                "unparsable model answer: " + e.getOriginalMessage(), e);
        }

        SummaryResponse response = new SummaryResponse();
        response.setShortSummary(text(root, "short_summary"));
        response.setLongSummary(text(root, "long_summary"));
        for (String section : List.of(SummaryResponse.CONTRIBUTION, SummaryResponse.LIMITATIONS, SummaryResponse.IDEAS)) {
            String value = text(root, section);
            if (!value.isBlank()) {
                response.getSections().put(section, value);
            }
        }
        response.setKeywords(keywords(root.get("keywords")));

        if (response.getShortSummary().isBlank() && response.getLongSummary().isBlank()) {
            throw new ExternalCallException(ExternalCallException.Kind.PERMANENT, "model answer has no summary fields");
        }
        return response;
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return "";
        }
        if (node.isArray()) {
            List<String> lines = new ArrayList<>();
            node.forEach(n -> lines.add("- " + n.asText()));
            return String.join("\n", lines);
        }
        return node.asText().strip();
    }

    /**
     * Keywords may come back as an array or as one comma or newline separated string.
     */
    private static List<String> keywords(JsonNode node) {
        List<String> keywords = new ArrayList<>();
        if (node == null || node.isNull()) {
            return keywords;
        }
        if (node.isArray()) {
            node.forEach(n -> {
                if (!n.asText().isBlank()) {
                    keywords.add(n.asText().strip());
                }
            });
            return keywords;
        }
        String raw = node.asText();
        String separator = raw.contains(",") ? "," : "\n";
        for (String part : raw.split(separator)) {
            if (!part.isBlank()) {
                keywords.add(part.strip());
            }
        }
        return keywords;
    }

    private static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }
}
