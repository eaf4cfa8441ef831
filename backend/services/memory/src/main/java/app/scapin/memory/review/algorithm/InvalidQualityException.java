package app.scapin.memory.review.algorithm;

public class InvalidQualityException extends IllegalArgumentException {

    private final int quality;

    public InvalidQualityException(int quality) {
        super("Quality must be 0-5, got " + quality);
        this.quality = quality;
    }

    public int getQuality() {
        return quality;
    }
}
