package util;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.complex.ComplexFloatType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

public class ImgLib2ToolsTest
{
	@Test
	public void testRowsAndCols()
	{
		final ArrayImg< DoubleType, DoubleArray > img = ArrayImgs.doubles( 7, 3 );

		assertEquals( 3, ImgLib2Tools.rows( img ) );
		assertEquals( 7, ImgLib2Tools.cols( img ) );
	}

	@Test
	public void testCopyOfView()
	{
		final ArrayImg< FloatType, FloatArray > img = ArrayImgs.floats( new float[] { 1, 2, 3, 4, 5, 6 }, 3, 2 );

		// transposed: 2 columns, 3 rows
		final ArrayImg< DoubleType, DoubleArray > copy = ImgLib2Tools.copyToDouble( Views.permute( img, 0, 1 ) );

		assertEquals( 2, copy.dimension( 0 ) );
		assertArrayEquals( new double[] { 1, 4, 2, 5, 3, 6 }, ImgLib2Tools.data( copy ), 0 );
	}

	@Test
	public void testCopyComplex()
	{
		final ArrayImg< ComplexFloatType, FloatArray > img = ArrayImgs.complexFloats( new float[] { 1, -1, 2, -2 }, 2, 1 );

		assertArrayEquals( new double[] { 1, -1, 2, -2 }, ImgLib2Tools.data( ImgLib2Tools.copyToComplexDouble( img ) ), 0 );
	}

	@Test
	public void testReadOnlyViews()
	{
		final ArrayImg< DoubleType, DoubleArray > img = ArrayImgs.doubles( new double[] { 1, 2 }, 2, 1 );
		final RandomAccessibleInterval< DoubleType > view = ImgLib2Tools.readOnly( img );

		final RandomAccess< DoubleType > ra = view.randomAccess();
		ra.setPosition( new long[] { 1, 0 } );

		assertEquals( 2, ra.get().get(), 0 );

		ra.get().set( 100 );
		assertArrayEquals( new double[] { 1, 2 }, ImgLib2Tools.data( img ), 0 );

		final ArrayImg< ComplexDoubleType, DoubleArray > c = ArrayImgs.complexDoubles( new double[] { 3, 4 }, 1, 1 );
		final RandomAccess< ComplexDoubleType > rc = ImgLib2Tools.readOnlyComplex( c ).randomAccess();
		rc.setPosition( new long[] { 0, 0 } );

		assertEquals( 4, rc.get().getImaginaryDouble(), 0 );

		rc.get().setReal( 0 );
		assertArrayEquals( new double[] { 3, 4 }, ImgLib2Tools.data( c ), 0 );
	}
}
