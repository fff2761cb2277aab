package pro.javacard.webeid.common;

import org.bouncycastle.util.encoders.Hex;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.security.SignatureException;

public class CryptoUtilsTests {

    @Test
    public void testDer2rs() throws Exception {
        // r with a leading zero byte, s shorter than the field
        byte[] der = Hex.decode("300a020300ff010203010203");
        Assert.assertEquals(Hex.toHexString(CryptoUtils.der2rs(der, 4)), "0000ff0100010203");
        Assert.assertEquals(CryptoUtils.rs2der(CryptoUtils.der2rs(der, 4)), der);
    }

    @Test(expectedExceptions = SignatureException.class)
    public void testTooLong() throws Exception {
        CryptoUtils.der2rs(Hex.decode("300a020300ff010203010203"), 1);
    }

    @Test(expectedExceptions = SignatureException.class)
    public void testGarbage() throws Exception {
        CryptoUtils.der2rs(Hex.decode("0403010203"), 32);
    }

    @Test
    public void testLeftpad() {
        Assert.assertEquals(CryptoUtils.leftpad(new byte[]{1, 2}, 4), new byte[]{0, 0, 1, 2});
        Assert.assertEquals(CryptoUtils.leftpad(new byte[]{0, 1, 2}, 2), new byte[]{1, 2});
    }
}
