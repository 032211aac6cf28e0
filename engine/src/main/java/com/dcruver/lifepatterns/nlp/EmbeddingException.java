package com.dcruver.lifepatterns.nlp;

import com.dcruver.lifepatterns.domain.LifePatternException;

/**
 * The embedding collaborator failed or returned unusable vectors.
 */
public class EmbeddingException extends LifePatternException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
