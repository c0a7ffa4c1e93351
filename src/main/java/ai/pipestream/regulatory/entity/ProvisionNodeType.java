package ai.pipestream.regulatory.entity;

/**
 * Structural units of a Croatian legal text, from the document root down to
 * indents, plus tables and annexes.
 * <p>
 * The rank orders containment: a node is a child of the nearest preceding
 * node with a strictly lower rank.
 */
public enum ProvisionNodeType {
    DOCUMENT("document", 0),
    DIO("dio", 1),
    PRILOG("prilog", 1),
    GLAVA("glava", 2),
    ODJELJAK("odjeljak", 3),
    PODODJELJAK("pododjeljak", 4),
    CLANAK("clanak", 5),
    STAVAK("stavak", 6),
    TOCKA("tocka", 7),
    PODTOCKA("podtocka", 8),
    ALINEJA("alineja", 9),
    TABLICA("tablica", 10),
    REDAK("redak", 11);

    private final String pathCode;
    private final int rank;

    ProvisionNodeType(String pathCode, int rank) {
        this.pathCode = pathCode;
        this.rank = rank;
    }

    public String pathCode() {
        return pathCode;
    }

    public int rank() {
        return rank;
    }
}
