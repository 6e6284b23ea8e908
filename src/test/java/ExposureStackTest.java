/**
** -----------------------------------------------------------------------------**
** ExposureStackTest.java
**
** Tests for ExposureStack
**
**
** Copyright (C) 2014 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  ExposureStackTest.java is free software: you can redistribute it and/or modify
**  it under the terms of the GNU General Public License as published by
**  the Free Software Foundation, either version 3 of the License, or
**  (at your option) any later version.
**
**  This program is distributed in the hope that it will be useful,
**  but WITHOUT ANY WARRANTY; without even the implied warranty of
**  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
**  GNU General Public License for more details.
**
**  You should have received a copy of the GNU General Public License
**  along with this program.  If not, see <http://www.gnu.org/licenses/>.
** -----------------------------------------------------------------------------**
**
*/

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.ShortProcessor;

import org.junit.Test;

public class ExposureStackTest {

	@Test
	public void exposureTimesAreReadFromImageProperties() throws CRFException {
		ImagePlus [] images={
				SyntheticExposures.withExposure("short", SyntheticExposures.constant(8, 4, 0.1f, 0.2f), 0.001),
				SyntheticExposures.withExposure("long",  SyntheticExposures.constant(8, 4, 0.4f, 0.8f), 0.004)};
		ExposureStack stack=new ExposureStack(images);
		assertEquals(2, stack.getNumExposures());
		assertEquals(2, stack.getNumChannels());
		assertEquals(8, stack.getWidth());
		assertEquals(4, stack.getHeight());
		assertEquals(0.004, stack.getExposure(1), 0.0);
		assertEquals(Math.log(0.001), stack.getLogExposures()[0], 1e-12);
		assertEquals(204, stack.getCode(1, 1, 3, 2));
	}

	@Test
	public void missingExposurePropertyIsInvalid() {
		ImagePlus [] images={
				SyntheticExposures.withExposure("first", SyntheticExposures.constant(8, 4, 0.1f), 0.01),
				new ImagePlus("second", SyntheticExposures.constant(8, 4, 0.2f))};
		try {
			new ExposureStack(images);
			fail("expected exception");
		} catch (CRFException e){
			assertEquals(CRFException.Kind.INVALID_PARAMETER, e.getKind());
		}
	}

	@Test
	public void unparsableExposurePropertyIsInvalid() {
		ImagePlus imp=new ImagePlus("bad", SyntheticExposures.constant(8, 4, 0.1f));
		imp.setProperty(ExposureStack.EXPOSURE_PROPERTY, "fast");
		try {
			ExposureStack.exposuresFromProperties(new ImagePlus[] {imp});
			fail("expected exception");
		} catch (CRFException e){
			assertEquals(CRFException.Kind.INVALID_PARAMETER, e.getKind());
		}
	}

	@Test
	public void nonPositiveExposureIsInvalid() {
		ImageStack [] stacks={
				SyntheticExposures.constant(8, 4, 0.1f),
				SyntheticExposures.constant(8, 4, 0.2f)};
		try {
			new ExposureStack(stacks, new double[] {0.01, 0.0});
			fail("expected exception");
		} catch (CRFException e){
			assertEquals(CRFException.Kind.INVALID_PARAMETER, e.getKind());
		}
	}

	@Test
	public void exposureCountMustMatchImages() {
		ImageStack [] stacks={SyntheticExposures.constant(8, 4, 0.1f)};
		try {
			new ExposureStack(stacks, new double[] {0.01, 0.02});
			fail("expected exception");
		} catch (CRFException e){
			assertEquals(CRFException.Kind.INVALID_PARAMETER, e.getKind());
		}
	}

	@Test
	public void colorImageIsSplitIntoChannels() {
		ColorProcessor cp=new ColorProcessor(4, 2);
		cp.set(1, 1, (255<<16)|(51<<8)|102);
		ImageStack channels=ExposureStack.getFloatChannels(new ImagePlus("rgb", cp));
		assertEquals(3, channels.getSize());
		int index=1*4+1;
		assertEquals(1.0f,        ((float []) channels.getPixels(1))[index], 1e-6f);
		assertEquals(51/255.0f,   ((float []) channels.getPixels(2))[index], 1e-6f);
		assertEquals(102/255.0f,  ((float []) channels.getPixels(3))[index], 1e-6f);
		assertEquals(0.0f,        ((float []) channels.getPixels(1))[0], 0.0f);
	}

	@Test
	public void integerImagesAreScaledToUnitRange() {
		ByteProcessor bp=new ByteProcessor(2, 2);
		bp.set(0, 0, 255);
		bp.set(1, 0, 51);
		float [] bytes=(float []) ExposureStack.getFloatChannels(new ImagePlus("8-bit", bp)).getPixels(1);
		assertEquals(1.0f, bytes[0], 1e-6f);
		assertEquals(0.2f, bytes[1], 1e-6f);

		ShortProcessor sp=new ShortProcessor(2, 2);
		sp.set(0, 0, 65535);
		float [] shorts=(float []) ExposureStack.getFloatChannels(new ImagePlus("16-bit", sp)).getPixels(1);
		assertEquals(1.0f, shorts[0], 1e-6f);
		assertEquals(0.0f, shorts[1], 0.0f);
	}

	@Test
	public void floatImageIsUsedAsIs() {
		ImageStack stack=SyntheticExposures.constant(3, 3, 0.25f);
		assertSame(stack.getPixels(1), ExposureStack.getFloatChannels(new ImagePlus("float", stack)).getPixels(1));
	}

	@Test
	public void codesAreRoundedAndClamped() {
		assertEquals(0,   ExposureStack.toCode(-0.2));
		assertEquals(0,   ExposureStack.toCode(Double.NaN));
		assertEquals(255, ExposureStack.toCode(1.3));
		assertEquals(128, ExposureStack.toCode(0.5));
		assertEquals(100, ExposureStack.toCode(100.49/255.0));
		assertEquals(101, ExposureStack.toCode(100.51/255.0));
	}
}
