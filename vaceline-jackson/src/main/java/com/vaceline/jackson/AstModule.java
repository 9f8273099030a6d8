package com.vaceline.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.vaceline.ast.*;
import com.vaceline.jackson.mixins.CommentsMixin;
import com.vaceline.jackson.mixins.NodeMixin;

/**
 * Jackson module that configures serialization/deserialization for the AST records.
 *
 * <ul>
 *   <li>Polymorphic node types through {@link NodeMixin}, keyed on {@code "type"}</li>
 *   <li>{@link Comments} holders written by {@link CommentsSerializer} and left out when empty</li>
 * </ul>
 *
 * Records are read through their canonical constructors, which needs parameter names
 * (see {@link VacelineJackson#createObjectMapper()}).
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(0, 1, 0, "SNAPSHOT", "com.vaceline", "vaceline-jackson"));
        addSerializer(Comments.class, new CommentsSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        context.setMixInAnnotations(Literal.class, NodeMixin.class);

        context.setMixInAnnotations(Comments.class, CommentsMixin.class);
        context.configOverride(Comments.class)
            .setIncludeAsProperty(JsonInclude.Value.construct(JsonInclude.Include.NON_EMPTY, null));
    }
}
