package com.example.reelreply.content;

/**
 * Outcome of a post call.
 *
 * @param id        id of the created object, if the platform returned one
 * @param duplicate the platform reported the target as already answered
 */
public record PostResult(String id, boolean duplicate) {

    public static PostResult created(String id) {
        return new PostResult(id, false);
    }

    public static PostResult alreadyReplied() {
        return new PostResult(null, true);
    }
}
