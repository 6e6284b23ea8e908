/**
** -----------------------------------------------------------------------------**
** CRFWeightFunctionTest.java
**
** Tests for CRFWeightFunction
**
**
** Copyright (C) 2014 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  CRFWeightFunctionTest.java is free software: you can redistribute it and/or modify
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
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class CRFWeightFunctionTest {
	private static final double DELTA=1e-12;

	@Test
	public void hatIsZeroAtEndsAndOneInTheMiddle() {
		assertEquals(0.0, CRFWeightFunction.HAT.weight(0.0), DELTA);
		assertEquals(0.0, CRFWeightFunction.HAT.weight(1.0), DELTA);
		assertEquals(1.0, CRFWeightFunction.HAT.weight(0.5), 0.0);
	}

	@Test
	public void hatIsSymmetric() {
		for (int i=0;i<=100;i++){
			double x=i/100.0;
			assertEquals(CRFWeightFunction.HAT.weight(x), CRFWeightFunction.HAT.weight(1.0-x), DELTA);
		}
	}

	@Test
	public void hatFollowsQuarticOfSquare() {
		double x=0.2;
		double s=(2*x-1)*(2*x-1);
		assertEquals(1.0-s*s*s*s, CRFWeightFunction.HAT.weight(x), DELTA);
	}

	@Test
	public void uniformTableIsAllOnes() {
		double [] w=CRFWeightFunction.ALL.getTable();
		assertEquals(256, w.length);
		for (int i=0;i<w.length;i++) assertEquals(1.0, w[i], 0.0);
	}

	@Test
	public void fullRangeTriangleReachesZeroAtEnds() {
		double [] w=CRFWeightFunction.DEB97.getTable();
		assertEquals(0.0, w[0], DELTA);
		assertEquals(0.0, w[255], DELTA);
		assertEquals(127/255.0, w[127], DELTA);
		assertEquals(127/255.0, w[128], DELTA);
	}

	@Test
	public void paddedTriangleIsNonzeroAtEnds() {
		double [] w=CRFWeightFunction.DEB97P01.getTable();
		assertEquals(0.01, w[0], 1e-9);
		assertEquals(0.01, w[255], 1e-9);
		assertTrue(w[128]>w[10]);
	}

	@Test
	public void gaussianPeaksInTheMiddle() {
		assertEquals(1.0, CRFWeightFunction.GAUSS.weight(0.5), DELTA);
		assertEquals(Math.exp(-2.0), CRFWeightFunction.GAUSS.weight(0.0), DELTA);
		assertEquals(CRFWeightFunction.GAUSS.weight(0.25), CRFWeightFunction.GAUSS.weight(0.75), DELTA);
	}

	@Test
	public void shiftedGaussianTailsReachZero() {
		assertEquals(0.0, CRFWeightFunction.GAUSS_SHIFTED.weight(0.0), DELTA);
		assertEquals(0.0, CRFWeightFunction.GAUSS_SHIFTED.weight(1.0), DELTA);
		assertEquals(1.0, CRFWeightFunction.GAUSS_SHIFTED.weight(0.5), DELTA);
	}

	@Test
	public void everyTableStaysInUnitRange() {
		for (CRFWeightFunction wf:CRFWeightFunction.values()){
			double [] w=wf.getTable();
			for (int i=0;i<w.length;i++){
				assertTrue(wf+" code "+i+" = "+w[i], (w[i]>=0.0) && (w[i]<=1.0));
			}
		}
	}

	@Test
	public void descriptionsFollowDeclarationOrder() {
		String [] descriptions=CRFWeightFunction.getDescriptions();
		assertEquals(CRFWeightFunction.values().length, descriptions.length);
		assertEquals(CRFWeightFunction.HAT.getDescription(), descriptions[CRFWeightFunction.HAT.ordinal()]);
	}
}
