package br.edu.ifba.finrag.evidence;

public enum FootnoteKind {
    CITATION,
    DELTA,
    TREND
}
