package com.vaceline.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vaceline.ast.Comment;

import java.util.List;

/**
 * Reads a {@link com.vaceline.ast.Comments} holder; absent lists become empty ones.
 * Writing is done by {@link com.vaceline.jackson.CommentsSerializer}.
 */
public abstract class CommentsMixin {

    @JsonCreator
    CommentsMixin(@JsonProperty("leading") List<Comment> leading,
                  @JsonProperty("trailing") List<Comment> trailing,
                  @JsonProperty("inner") List<Comment> inner) {
    }
}
