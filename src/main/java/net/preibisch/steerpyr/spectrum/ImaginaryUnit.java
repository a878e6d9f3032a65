/*-
 * #%L
 * Complex steerable pyramid decomposition and reconstruction
 * of two-dimensional images.
 * %%
 * Copyright (C) 2024 - 2026 Steerable Pyramid developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package net.preibisch.steerpyr.spectrum;

import net.imglib2.type.numeric.complex.ComplexDoubleType;

/**
 * Integer powers of +i and -i, evaluated by exponent mod 4 so that (-i)^n * (+i)^n is exactly one.
 */
public class ImaginaryUnit
{
	/**
	 * @param exponent - any integer
	 * @return (+i)^exponent
	 */
	public static ComplexDoubleType pow( final int exponent )
	{
		switch ( Math.floorMod( exponent, 4 ) )
		{
		case 0:
			return new ComplexDoubleType( 1, 0 );
		case 1:
			return new ComplexDoubleType( 0, 1 );
		case 2:
			return new ComplexDoubleType( -1, 0 );
		default:
			return new ComplexDoubleType( 0, -1 );
		}
	}

	/**
	 * @param exponent - any integer
	 * @return (-i)^exponent, the complex conjugate of (+i)^exponent
	 */
	public static ComplexDoubleType negativePow( final int exponent )
	{
		final ComplexDoubleType p = pow( exponent );
		p.complexConjugate();
		return p;
	}
}
