package com.forum.websocket.domain;

/**
 * Content that carries an up/down vote tally.
 * The counters are a cached derivation of the {@link VoteRecord} rows for the entity.
 */
public interface Votable {

    String getId();

    String getOwnerId();

    int getUpvoteCount();

    void setUpvoteCount(int upvoteCount);

    int getDownvoteCount();

    void setDownvoteCount(int downvoteCount);

    Long getVersion();

    EntityKind kind();

    /** Thread the content belongs to (the thread itself for threads). */
    String threadId();

    /** Title used in notification text. */
    String displayTitle();
}
