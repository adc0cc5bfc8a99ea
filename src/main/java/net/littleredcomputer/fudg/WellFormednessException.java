package net.littleredcomputer.fudg;

/**
 * The downward pass found a node with no possible attachment: the annotation admits
 * no full resolution.
 */
public class WellFormednessException extends IllegalStateException {
    private final String nodeName;

    WellFormednessException(String nodeName) {
        super("Could not find any possible heads for <" + nodeName + ">. Is the annotation valid?");
        this.nodeName = nodeName;
    }

    public String nodeName() { return nodeName; }
}
