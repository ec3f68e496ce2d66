// This file is part of the PDDL Front-End (pfe).
//
// The PDDL Front-End is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The PDDL Front-End is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the PDDL Front-End. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package pddlfront.util;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * An exact rational number, always held in lowest terms with a positive
 * denominator. Numeric literals in PDDL documents (e.g. <code>3</code>,
 * <code>1.5</code> or <code>3/2</code>) are read as rationals so that no
 * precision is lost before a literal is classified as an integer or a real.
 *
 * @author David J. Pearce
 *
 */
public final class Rational implements Comparable<Rational> {
	public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
	public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);

	private final BigInteger numerator;
	private final BigInteger denominator;

	private Rational(BigInteger numerator, BigInteger denominator) {
		this.numerator = numerator;
		this.denominator = denominator;
	}

	/**
	 * Construct a rational from a numerator and (non-zero) denominator, reducing
	 * it to lowest terms.
	 *
	 * @param numerator
	 * @param denominator
	 * @return
	 */
	public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
		if (denominator.signum() == 0) {
			throw new ArithmeticException("zero denominator");
		} else if (denominator.signum() < 0) {
			numerator = numerator.negate();
			denominator = denominator.negate();
		}
		BigInteger gcd = numerator.gcd(denominator);
		if (gcd.signum() != 0 && !gcd.equals(BigInteger.ONE)) {
			numerator = numerator.divide(gcd);
			denominator = denominator.divide(gcd);
		}
		return new Rational(numerator, denominator);
	}

	public static Rational valueOf(BigInteger value) {
		return new Rational(value, BigInteger.ONE);
	}

	public static Rational valueOf(long value) {
		return valueOf(BigInteger.valueOf(value));
	}

	/**
	 * Parse a rational from its textual form. This accepts integers
	 * (<code>-3</code>), decimals (<code>1.5</code>, <code>2e3</code>) and
	 * fractions (<code>3/2</code>).
	 *
	 * @param text
	 * @return
	 * @throws NumberFormatException
	 *             if the text is not a number.
	 */
	public static Rational parse(String text) {
		int slash = text.indexOf('/');
		if (slash >= 0) {
			BigInteger n = new BigInteger(text.substring(0, slash));
			BigInteger d = new BigInteger(text.substring(slash + 1));
			if (d.signum() == 0) {
				throw new NumberFormatException("zero denominator: " + text);
			}
			return valueOf(n, d);
		}
		BigDecimal decimal = new BigDecimal(text);
		int scale = decimal.scale();
		if (scale <= 0) {
			return valueOf(decimal.toBigIntegerExact());
		} else {
			return valueOf(decimal.unscaledValue(), BigInteger.TEN.pow(scale));
		}
	}

	public BigInteger numerator() {
		return numerator;
	}

	public BigInteger denominator() {
		return denominator;
	}

	public boolean isInteger() {
		return denominator.equals(BigInteger.ONE);
	}

	public int signum() {
		return numerator.signum();
	}

	public Rational negate() {
		return new Rational(numerator.negate(), denominator);
	}

	public Rational add(Rational r) {
		return valueOf(numerator.multiply(r.denominator).add(r.numerator.multiply(denominator)),
				denominator.multiply(r.denominator));
	}

	public Rational subtract(Rational r) {
		return add(r.negate());
	}

	public Rational multiply(Rational r) {
		return valueOf(numerator.multiply(r.numerator), denominator.multiply(r.denominator));
	}

	public Rational divide(Rational r) {
		return valueOf(numerator.multiply(r.denominator), denominator.multiply(r.numerator));
	}

	@Override
	public int compareTo(Rational r) {
		return numerator.multiply(r.denominator).compareTo(r.numerator.multiply(denominator));
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Rational) {
			Rational r = (Rational) o;
			return numerator.equals(r.numerator) && denominator.equals(r.denominator);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return numerator.hashCode() * 31 + denominator.hashCode();
	}

	@Override
	public String toString() {
		if (isInteger()) {
			return numerator.toString();
		} else {
			return numerator + "/" + denominator;
		}
	}
}
