package com.g11macro.manager.service;

import com.g11macro.manager.dto.NormalizeResponse;
import com.g11macro.manager.dto.ParseResponse;
import com.g11macro.manager.dto.SerializeRequest;
import com.g11macro.manager.dto.SerializeResponse;
import com.g11macro.manager.dto.TextRequest;
import com.g11macro.manager.dto.TokenizeResponse;
import com.g11macro.manager.exception.InvalidEnumValueException;
import com.g11macro.manager.exception.RonParseException;
import com.g11macro.manager.model.KeyBinding;
import com.g11macro.manager.ron.RonParser;
import com.g11macro.manager.ron.RonSerializer;
import com.g11macro.manager.ron.RonToken;
import com.g11macro.manager.ron.RonTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class RonDocumentService {

    private static final Logger logger = LoggerFactory.getLogger(RonDocumentService.class);

    private final BindingValidator validator;

    public RonDocumentService(BindingValidator validator) {
        this.validator = validator;
    }

    public ParseResponse parse(TextRequest request) {
        long startTime = System.currentTimeMillis();
        String text = request.text();
        logger.info("Parsing key binding document of {} characters", text.length());

        try {
            List<KeyBinding> bindings = RonParser.parse(text);
            long analysisTime = System.currentTimeMillis() - startTime;
            logger.info("Parsed {} bindings in {}ms", bindings.size(), analysisTime);
            return ParseResponse.success(bindings, analysisTime);

        } catch (RonParseException | InvalidEnumValueException e) {
            long analysisTime = System.currentTimeMillis() - startTime;
            logger.warn("Key binding document rejected: {}", e.getMessage());
            return ParseResponse.error(e.getMessage(), analysisTime);
        }
    }

    public SerializeResponse serialize(SerializeRequest request) {
        List<KeyBinding> bindings = request.bindings();
        List<String> violations = validator.checkRepeats(bindings);
        if (!violations.isEmpty()) {
            logger.warn("Refusing to serialize {} bindings: {}", bindings.size(), violations);
            return SerializeResponse.rejected(violations);
        }
        String text = RonSerializer.serialize(bindings);
        logger.debug("Serialized {} bindings to {} characters", bindings.size(), text.length());
        return SerializeResponse.success(text, bindings.size());
    }

    public TokenizeResponse tokenize(TextRequest request) {
        long startTime = System.currentTimeMillis();
        List<RonToken> tokens = RonTokenizer.tokenize(request.text());
        long analysisTime = System.currentTimeMillis() - startTime;
        logger.debug("Tokenized document into {} tokens in {}ms", tokens.size(), analysisTime);
        return new TokenizeResponse(tokens, analysisTime);
    }

    /**
     * Re-emits a document in canonical layout. Comments, unknown entries and formatting are lost.
     */
    public NormalizeResponse normalize(TextRequest request) {
        ParseResponse parsed = parse(request);
        if (!parsed.success()) {
            return NormalizeResponse.error(parsed.error());
        }
        return NormalizeResponse.success(RonSerializer.serialize(parsed.bindings()));
    }
}
