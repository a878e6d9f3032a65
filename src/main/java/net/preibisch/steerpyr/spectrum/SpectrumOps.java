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

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * The array operations the pyramid needs from a numerical backend. All images are 2d, dimension 0 is the
 * column (x), dimension 1 the row (y). Every operation returns a new image and leaves its inputs untouched,
 * except {@link #addTo(ArrayImg, ArrayImg)} which accumulates into its first argument.
 * <p>
 * Implementations must be thread-safe, one instance is shared by all threads of a batch. Different
 * implementations may differ by floating-point rounding only.
 */
public interface SpectrumOps
{
	/**
	 * @return the discrete Fourier transform (zero frequency at index 0)
	 */
	public ArrayImg< ComplexDoubleType, DoubleArray > fft( ArrayImg< ComplexDoubleType, DoubleArray > img );

	/**
	 * @return the normalized inverse discrete Fourier transform, ifft( fft( x ) ) == x
	 */
	public ArrayImg< ComplexDoubleType, DoubleArray > ifft( ArrayImg< ComplexDoubleType, DoubleArray > spectrum );

	/**
	 * @return the spectrum with the zero frequency moved to row floor(rows/2), column floor(cols/2)
	 */
	public ArrayImg< ComplexDoubleType, DoubleArray > fftShift( ArrayImg< ComplexDoubleType, DoubleArray > spectrum );

	/**
	 * @return the inverse of {@link #fftShift(ArrayImg)}, also for odd sizes
	 */
	public ArrayImg< ComplexDoubleType, DoubleArray > ifftShift( ArrayImg< ComplexDoubleType, DoubleArray > spectrum );

	/**
	 * @return the part of the spectrum inside the window
	 */
	public ArrayImg< ComplexDoubleType, DoubleArray > crop( ArrayImg< ComplexDoubleType, DoubleArray > spectrum, CropWindow window );

	/**
	 * @return a zero spectrum of the window's source size with the given spectrum placed inside the window
	 */
	public ArrayImg< ComplexDoubleType, DoubleArray > embed( ArrayImg< ComplexDoubleType, DoubleArray > spectrum, CropWindow window );

	/**
	 * @return spectrum * mask, pixel by pixel
	 */
	public ArrayImg< ComplexDoubleType, DoubleArray > multiply( ArrayImg< ComplexDoubleType, DoubleArray > spectrum, ArrayImg< DoubleType, DoubleArray > mask );

	/**
	 * @return spectrum * factor, pixel by pixel
	 */
	public ArrayImg< ComplexDoubleType, DoubleArray > multiply( ArrayImg< ComplexDoubleType, DoubleArray > spectrum, ComplexDoubleType factor );

	/**
	 * target += summand, pixel by pixel
	 */
	public void addTo( ArrayImg< ComplexDoubleType, DoubleArray > target, ArrayImg< ComplexDoubleType, DoubleArray > summand );

	/**
	 * @return the real part
	 */
	public ArrayImg< DoubleType, DoubleArray > real( ArrayImg< ComplexDoubleType, DoubleArray > img );

	/**
	 * @return the image with a zero imaginary part
	 */
	public ArrayImg< ComplexDoubleType, DoubleArray > toComplex( ArrayImg< DoubleType, DoubleArray > img );

	/**
	 * @return fftShift( fft( img ) )
	 */
	public default ArrayImg< ComplexDoubleType, DoubleArray > forwardCentered( final ArrayImg< ComplexDoubleType, DoubleArray > img )
	{
		return fftShift( fft( img ) );
	}

	/**
	 * @return ifft( ifftShift( spectrum ) )
	 */
	public default ArrayImg< ComplexDoubleType, DoubleArray > inverseCentered( final ArrayImg< ComplexDoubleType, DoubleArray > spectrum )
	{
		return ifft( ifftShift( spectrum ) );
	}
}
