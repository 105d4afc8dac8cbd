package com.marketplace.conversation.engine;

import java.util.Optional;

/**
 * Optional generator of reply text, e.g. backed by a language model. When a bean is present the
 * selector asks it before the template buckets; high-risk messages never reach it.
 */
public interface CandidateTextSource {

    Optional<String> suggest(ResponseContext context);
}
