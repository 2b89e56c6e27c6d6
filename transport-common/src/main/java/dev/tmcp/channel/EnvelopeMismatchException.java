package dev.tmcp.channel;

public class EnvelopeMismatchException extends EnvelopeDecodeException {

    private final EnvelopeAddress address;

    public EnvelopeMismatchException(EnvelopeAddress address, String expectedSender, String expectedReceiver) {
        super("Envelope addressed " + address.sender() + " -> " + address.receiver() + ", expected "
                + expectedSender + " -> " + expectedReceiver);
        this.address = address;
    }

    public EnvelopeAddress address() {
        return this.address;
    }
}
