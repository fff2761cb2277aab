package pro.javacard.webeid.common;

import java.io.IOException;

public interface PinProvider {

    // Fills the buffer with the PIN. User cancel and timeout are reported as VerifyPinFailed.
    void getPin(PinBuffer pin, ElectronicID eid) throws VerifyPinFailed, IOException;
}
