package com.vaceline.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.vaceline.ast.Comment;
import com.vaceline.ast.Comments;

import java.io.IOException;
import java.util.List;

/**
 * Writes only the non-empty comment lists. An empty holder counts as empty for
 * {@code JsonInclude.Include.NON_EMPTY}, so statements without comments carry no
 * {@code "comments"} property at all.
 */
public class CommentsSerializer extends StdSerializer<Comments> {

    public CommentsSerializer() {
        super(Comments.class);
    }

    @Override
    public boolean isEmpty(SerializerProvider provider, Comments value) {
        return value == null || value.isEmpty();
    }

    @Override
    public void serialize(Comments value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        writeList("leading", value.leading(), gen, provider);
        writeList("trailing", value.trailing(), gen, provider);
        writeList("inner", value.inner(), gen, provider);
        gen.writeEndObject();
    }

    private static void writeList(String name, List<Comment> comments, JsonGenerator gen,
                                  SerializerProvider provider) throws IOException {
        if (!comments.isEmpty()) {
            gen.writeFieldName(name);
            provider.defaultSerializeValue(comments, gen);
        }
    }
}
