package nl.nfi.djcnf.cnf;

// a titled snapshot of the grammar after one pipeline stage
public record TransformationStep(String title, String snapshot) {

}
