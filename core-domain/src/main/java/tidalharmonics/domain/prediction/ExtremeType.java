package tidalharmonics.domain.prediction;

public enum ExtremeType {
    HIGH,
    LOW;

    public ExtremeType opposite() {
        return this == HIGH ? LOW : HIGH;
    }
}
