package utility;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Non-interactive proof of knowledge of x such that pk = g^x mod p, as sent
 * by a voter at registration.
 *
 * @author Nakamoteam
 */
public class SchnorrProof implements Serializable {

    private final BigInteger pk; // public key g^x
    private final BigInteger gv; // commitment g^v
    private final BigInteger r; // response v - x*c mod n

    public SchnorrProof(BigInteger pk, BigInteger gv, BigInteger r) {
        this.pk = Objects.requireNonNull(pk, "pk");
        this.gv = Objects.requireNonNull(gv, "gv");
        this.r = Objects.requireNonNull(r, "r");
    }

    public BigInteger getPk() {
        return pk;
    }

    public BigInteger getGv() {
        return gv;
    }

    public BigInteger getR() {
        return r;
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
        final SchnorrProof other = (SchnorrProof) obj;
        if (!Objects.equals(this.pk, other.pk)) {
            return false;
        }
        if (!Objects.equals(this.gv, other.gv)) {
            return false;
        }
        if (!Objects.equals(this.r, other.r)) {
            return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Objects.hash(pk, gv, r);
    }

    @Override
    public String toString() {
        return "pk=" + Utils.shortHex(pk) + ", gv=" + Utils.shortHex(gv) + ", r=" + Utils.shortHex(r);
    }

}
