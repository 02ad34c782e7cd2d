package utility;

import java.io.Serializable;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Objects;
import org.bouncycastle.crypto.agreement.DHStandardGroups;
import org.bouncycastle.crypto.params.DHParameters;
import org.bouncycastle.util.BigIntegers;

/**
 *
 * @author Nakamoteam
 */
public class GroupParameters implements Serializable {

    private final BigInteger p, g; // prime modulus and generator of the field
    private final BigInteger n; // exponents are reduced mod n = p - 1, the order of Z_p*

    public GroupParameters(BigInteger p, BigInteger g) {
        this.p = Objects.requireNonNull(p, "p");
        this.g = Objects.requireNonNull(g, "g");
        this.n = p.subtract(BigInteger.ONE);
    }

    /**
     * @brief The 2048-bit MODP group of RFC 3526 (safe prime, generator 2)
     */
    public static GroupParameters rfc3526() {
        DHParameters dh = DHStandardGroups.rfc3526_2048;
        return new GroupParameters(dh.getP(), dh.getG());
    }

    public BigInteger getP() {
        return p;
    }

    public BigInteger getG() {
        return g;
    }

    public BigInteger getExponentModulus() {
        return n;
    }

    /**
     * @return g^exponent mod p
     */
    public BigInteger exp(BigInteger exponent) {
        return ModularArithmetic.power(g, exponent, p);
    }

    /**
     * @return an exponent drawn uniformly from [1, n)
     */
    public BigInteger randomExponent(SecureRandom random) {
        return BigIntegers.createRandomInRange(BigInteger.ONE, n.subtract(BigInteger.ONE), random);
    }

    /**
     * @return true if 0 < element < p
     */
    public boolean isElement(BigInteger element) {
        return element != null && element.signum() > 0 && element.compareTo(p) < 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null) {
            return false;
        }
        if (getClass() != obj.getClass()) {
            return false;
        }
        final GroupParameters other = (GroupParameters) obj;
        if (!Objects.equals(this.p, other.p)) {
            return false;
        }
        if (!Objects.equals(this.g, other.g)) {
            return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Objects.hash(p, g);
    }

    @Override
    public String toString() {
        return "GroupParameters{" + "p=" + Utils.shortHex(p) + " (" + p.bitLength() + " bits), g=" + g + '}';
    }

}
