package pro.javacard.webeid.common;

public final class PinInfo {
    private final int minLength;
    private final int maxLength;
    private final boolean pinPad;

    public PinInfo(int minLength, int maxLength, boolean pinPad) {
        if (minLength < 1 || maxLength < minLength || maxLength > PinBuffer.CAPACITY)
            throw new IllegalArgumentException(String.format("Invalid PIN length range %d..%d", minLength, maxLength));
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.pinPad = pinPad;
    }

    public int getMinLength() {
        return minLength;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public boolean hasPinPad() {
        return pinPad;
    }

    public boolean isValidLength(int length) {
        return length >= minLength && length <= maxLength;
    }

    @Override
    public String toString() {
        return String.format("PIN %d-%d%s", minLength, maxLength, pinPad ? " (PIN pad)" : "");
    }
}
