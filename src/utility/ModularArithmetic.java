package utility;

import java.math.BigInteger;

/**
 *
 * @author Nakamoteam
 */
public final class ModularArithmetic {

    private ModularArithmetic() {
    }

    /**
     * @brief Modular exponentiation base^exponent mod modulus, by repeated
     * squaring over the bits of the exponent (least significant first)
     * @param base non-negative base
     * @param exponent non-negative exponent, up to the size of the field
     * @param modulus positive modulus
     * @return base^exponent mod modulus, or 0 when the modulus is 1
     */
    public static BigInteger power(BigInteger base, BigInteger exponent, BigInteger modulus) {
        checkModulus(modulus);
        if (exponent.signum() < 0) {
            throw new IllegalArgumentException("negative exponent");
        }
        if (modulus.equals(BigInteger.ONE)) {
            return BigInteger.ZERO;
        }

        BigInteger result = BigInteger.ONE;
        BigInteger square = base.mod(modulus); // base^(2^i) at step i
        for (int i = 0; i < exponent.bitLength(); i++) {
            if (exponent.testBit(i)) {
                result = result.multiply(square).mod(modulus);
            }
            square = square.multiply(square).mod(modulus);
        }
        return result;
    }

    public static BigInteger mulMod(BigInteger a, BigInteger b, BigInteger modulus) {
        checkModulus(modulus);
        return a.multiply(b).mod(modulus);
    }

    public static BigInteger addMod(BigInteger a, BigInteger b, BigInteger modulus) {
        checkModulus(modulus);
        return a.add(b).mod(modulus);
    }

    public static BigInteger subMod(BigInteger a, BigInteger b, BigInteger modulus) {
        checkModulus(modulus);
        return a.subtract(b).mod(modulus); // mod() never returns a negative value
    }

    /**
     * @brief Multiplicative inverse of a modulo a prime modulus
     * @throws ArithmeticException if a is not invertible
     */
    public static BigInteger inverse(BigInteger a, BigInteger modulus) {
        checkModulus(modulus);
        return a.modInverse(modulus);
    }

    private static void checkModulus(BigInteger modulus) {
        if (modulus.signum() <= 0) {
            throw new IllegalArgumentException("modulus must be positive: " + modulus);
        }
    }
}
