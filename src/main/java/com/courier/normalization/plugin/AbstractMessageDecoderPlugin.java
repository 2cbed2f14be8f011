package com.courier.normalization.plugin;

import com.courier.domain.EventEnvelope;
import com.courier.normalization.parsers.MessageParser;

/**
 * Base class for plugins that parse the record message with a
 * {@link MessageParser} and map the result through the {@link FieldMapper}.
 */
public abstract class AbstractMessageDecoderPlugin implements MessageDecoderPlugin {

    protected final FieldMapper fieldMapper;

    protected AbstractMessageDecoderPlugin(FieldMapper fieldMapper) {
        this.fieldMapper = fieldMapper;
    }

    /**
     * Parse the record message, reusing an earlier parse of the same format
     *
     * @return the parse result, or null if the message is absent or not in this format
     */
    protected <T> T parseMessage(EventEnvelope record, ParsingCache cache, MessageParser<T> parser) {
        String message = record.getMessage();
        if (message == null || message.isEmpty()) {
            return null;
        }
        return cache.getOrCompute(parser.cacheKey(), message, parser::parse);
    }
}
