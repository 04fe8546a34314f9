package pl.marcinmilkowski.word_fold.output;

import pl.marcinmilkowski.word_fold.fold.Frame;
import pl.marcinmilkowski.word_fold.forest.Vocabulary;

import java.io.IOException;
import java.io.Writer;
import java.util.OptionalInt;

/**
 * Line-oriented rendering: a divider line, then the words of the defined
 * slots in slot order, one per line. Reserved slots are never written.
 */
public class TextFrameEmitter implements FrameEmitter {

    public static final String DEFAULT_DIVIDER = "/////////////////////////////////";

    private final Vocabulary vocabulary;
    private final Writer out;
    private final String divider;
    private final boolean rootHeaders;

    public TextFrameEmitter(Vocabulary vocabulary, Writer out, String divider, boolean rootHeaders) {
        this.vocabulary = vocabulary;
        this.out = out;
        this.divider = divider;
        this.rootHeaders = rootHeaders;
    }

    public TextFrameEmitter(Vocabulary vocabulary, Writer out) {
        this(vocabulary, out, DEFAULT_DIVIDER, false);
    }

    @Override
    public void beginRoot(int root) throws IOException {
        if (rootHeaders) {
            line("root: " + vocabulary.resolve(root));
        }
    }

    @Override
    public void emit(Frame frame) throws IOException {
        // resolve everything first so a bad id never leaves half a frame behind
        StringBuilder sb = new StringBuilder();
        sb.append(divider).append('\n');
        for (int i = 0; i < Frame.SLOT_COUNT; i++) {
            OptionalInt word = frame.slot(i);
            if (word.isPresent()) {
                sb.append(vocabulary.resolve(word.getAsInt())).append('\n');
            }
        }
        out.write(sb.toString());
    }

    @Override
    public void finish() throws IOException {
        out.flush();
    }

    private void line(String text) throws IOException {
        out.write(text);
        out.write('\n');
    }
}
