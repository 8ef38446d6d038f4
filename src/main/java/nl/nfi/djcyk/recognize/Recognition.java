package nl.nfi.djcyk.recognize;

import nl.nfi.djcyk.cyk.ParseResult;
import nl.nfi.djcyk.tree.ParseTree;

import java.util.List;

// tree is null for rejected sentences
public record Recognition(String sentence, List<String> tokens, ParseResult result, ParseTree tree) {

    public boolean accepted() {
        return result.accepted();
    }
}
