package pl.marcinmilkowski.word_fold.output;

import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.word_fold.fold.Frame;
import pl.marcinmilkowski.word_fold.forest.Vocabulary;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes one JSON object per frame, one per line.
 */
public class JsonFrameEmitter implements FrameEmitter {

    private final Vocabulary vocabulary;
    private final Writer out;

    public JsonFrameEmitter(Vocabulary vocabulary, Writer out) {
        this.vocabulary = vocabulary;
        this.out = out;
    }

    @Override
    public void emit(Frame frame) throws IOException {
        out.write(toJson(frame).toJSONString());
        out.write('\n');
    }

    @Override
    public void finish() throws IOException {
        out.flush();
    }

    JSONObject toJson(Frame frame) {
        JSONObject obj = new JSONObject();
        obj.put("root", vocabulary.resolve(frame.root()));
        obj.put("main_branch", vocabulary.resolve(frame.mainBranch()));
        obj.put("main_leaf", vocabulary.resolve(frame.mainLeaf()));
        obj.put("sweep_branch", vocabulary.resolve(frame.sweepBranch()));
        obj.put("continuation", vocabulary.resolve(frame.continuation()));
        obj.put("sweep_leaf", vocabulary.resolve(frame.sweepLeaf()));
        return obj;
    }
}
