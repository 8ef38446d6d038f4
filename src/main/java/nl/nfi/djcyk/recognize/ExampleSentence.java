package nl.nfi.djcyk.recognize;

// a sentence shipped with a language, together with whether it should be accepted
public record ExampleSentence(String sentence, boolean expectedAccepted) {

}
