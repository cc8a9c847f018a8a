package org.neuralchilli.irflow.config;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import org.neuralchilli.irflow.domain.IrProgram;

import java.io.IOException;

/**
 * Hazelcast serializer storing programs as JSON text.
 * Every read yields a fresh copy of the stored program.
 */
public class IrProgramSerializer implements StreamSerializer<IrProgram> {

    private static final int TYPE_ID = 2001;

    @Override
    public void write(ObjectDataOutput out, IrProgram program) throws IOException {
        out.writeString(IrJson.toJson(program));
    }

    @Override
    public IrProgram read(ObjectDataInput in) throws IOException {
        String json = in.readString();
        try {
            return IrJson.fromJson(json);
        } catch (IllegalArgumentException e) {
            throw new IOException("Corrupt stored program", e);
        }
    }

    @Override
    public int getTypeId() {
        return TYPE_ID;
    }

    @Override
    public void destroy() {
    }
}
