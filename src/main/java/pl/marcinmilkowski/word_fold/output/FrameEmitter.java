package pl.marcinmilkowski.word_fold.output;

import pl.marcinmilkowski.word_fold.fold.Frame;

import java.io.IOException;

/**
 * Receives frames as the enumeration produces them.
 *
 * Frames are immutable, so an emitter may retain them.
 */
public interface FrameEmitter {

    /**
     * Called once before the first frame of each enumerated root.
     */
    default void beginRoot(int root) throws IOException {
    }

    void emit(Frame frame) throws IOException;

    /**
     * Called once after the last root.
     */
    default void finish() throws IOException {
    }
}
