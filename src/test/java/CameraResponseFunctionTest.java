/**
** -----------------------------------------------------------------------------**
** CameraResponseFunctionTest.java
**
** Tests for CameraResponseFunction
**
**
** Copyright (C) 2014 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  CameraResponseFunctionTest.java is free software: you can redistribute it and/or modify
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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class CameraResponseFunctionTest {
	@Rule
	public TemporaryFolder folder=new TemporaryFolder();

	private static double [] line(double slope){
		double [] curve=new double[256];
		for (int i=0;i<256;i++) curve[i]=slope*i;
		return curve;
	}

	@Test
	public void normalizedMaximumIsExactlyOne() {
		CameraResponseFunction crf=CameraResponseFunction.normalized(
				new double[][] {line(3.7), line(0.01)}, CameraResponseFunction.Source.DEBEVEC_MALIK, CRFWeightFunction.HAT, false);
		assertEquals(1.0f, crf.getMax(0), 0.0f);
		assertEquals(1.0f, crf.getMax(1), 0.0f);
		assertEquals(128/255.0, crf.getValue(1, 128), 1e-6);
		assertEquals(CRFWeightFunction.HAT, crf.getWeightFunction());
	}

	@Test
	public void normalizationDoesNotModifyInput() {
		double [] curve=line(2.0);
		CameraResponseFunction.normalized(new double[][] {curve}, CameraResponseFunction.Source.DEBEVEC_MALIK, null, true);
		assertEquals(510.0, curve[255], 0.0);
	}

	@Test
	public void poolAdjacentViolators() {
		assertArrayEquals(new double[] {1.0, 2.5, 2.5, 4.0},
				CameraResponseFunction.makeMonotonic(new double[] {1.0, 3.0, 2.0, 4.0}), 1e-12);
		assertArrayEquals(new double[] {2.0, 2.0, 2.0},
				CameraResponseFunction.makeMonotonic(new double[] {3.0, 2.0, 1.0}), 1e-12);
		double [] increasing={0.1, 0.2, 0.2, 0.7};
		assertArrayEquals(increasing, CameraResponseFunction.makeMonotonic(increasing), 0.0);
	}

	@Test
	public void curvesAreCopies() {
		float [] values=new float[256];
		for (int i=0;i<256;i++) values[i]=i/255.0f;
		CameraResponseFunction crf=new CameraResponseFunction(new float[][] {values}, CameraResponseFunction.Source.LOADED, null);
		values[10]=5.0f;
		float [] curve=crf.getCurve(0);
		curve[20]=5.0f;
		assertEquals(10/255.0f, crf.getValue(0, 10), 0.0f);
		assertEquals(20/255.0f, crf.getValue(0, 20), 0.0f);
		assertTrue(crf.isMonotonic());
	}

	@Test(expected=IllegalArgumentException.class)
	public void wrongCurveLengthIsRejected() {
		new CameraResponseFunction(new float[][] {new float[255]}, CameraResponseFunction.Source.LOADED, null);
	}

	@Test
	public void savedResponseLoadsBack() throws IOException, CRFException {
		float [][] icrf=new float[3][256];
		for (int chn=0;chn<3;chn++) for (int i=0;i<256;i++) icrf[chn][i]=(float) Math.pow(i/255.0, 2.0+0.1*chn);
		CameraResponseFunction crf=new CameraResponseFunction(icrf, CameraResponseFunction.Source.DEBEVEC_MALIK, CRFWeightFunction.DEB97);
		String path=new File(folder.getRoot(), "response.xml").getPath();
		crf.saveToXML(path, "test response");
		CameraResponseFunction loaded=CameraResponseFunction.loadFromXML(path);
		assertEquals(CameraResponseFunction.Source.LOADED, loaded.getSource());
		assertEquals(CRFWeightFunction.DEB97, loaded.getWeightFunction());
		assertEquals(3, loaded.getNumChannels());
		for (int chn=0;chn<3;chn++) assertArrayEquals(icrf[chn], loaded.getCurve(chn), 0.0f);
	}

	@Test
	public void responseWithoutWeightsLoadsBack() throws IOException, CRFException {
		float [][] icrf={new float[256]};
		String path=new File(folder.getRoot(), "raw-jpeg.xml").getPath();
		new CameraResponseFunction(icrf, CameraResponseFunction.Source.RAW_JPEG, null).saveToXML(path);
		assertNull(CameraResponseFunction.loadFromXML(path).getWeightFunction());
	}

	@Test
	public void truncatedChannelIsRejected() throws IOException {
		File file=folder.newFile("short.xml");
		FileWriter writer=new FileWriter(file);
		try {
			writer.write("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"+
					"<cameraResponseFunction><source>LOADED</source><channels>1</channels>"+
					"<channel><index>0</index><icrf>0.0 0.5 1.0</icrf></channel></cameraResponseFunction>\n");
		} finally {
			writer.close();
		}
		try {
			CameraResponseFunction.loadFromXML(file.getPath());
			fail("expected exception");
		} catch (CRFException e){
			assertEquals(CRFException.Kind.INVALID_PARAMETER, e.getKind());
		}
	}

	@Test
	public void declaredChannelCountMustMatch() throws IOException {
		File file=folder.newFile("count.xml");
		FileWriter writer=new FileWriter(file);
		try {
			writer.write("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"+
					"<cameraResponseFunction><source>LOADED</source><channels>2</channels></cameraResponseFunction>\n");
		} finally {
			writer.close();
		}
		try {
			CameraResponseFunction.loadFromXML(file.getPath());
			fail("expected exception");
		} catch (CRFException e){
			assertEquals(CRFException.Kind.CHANNEL_COUNT_MISMATCH, e.getKind());
		}
	}

	@Test(expected=IOException.class)
	public void missingFileIsIOException() throws IOException, CRFException {
		CameraResponseFunction.loadFromXML(new File(folder.getRoot(), "none.xml").getPath());
	}

	@Test
	public void decreasingCurveIsReported() {
		float [] values=new float[256];
		for (int i=0;i<256;i++) values[i]=1.0f-i/255.0f;
		assertFalse(new CameraResponseFunction(new float[][] {values}, CameraResponseFunction.Source.LOADED, null).isMonotonic(0));
	}
}
