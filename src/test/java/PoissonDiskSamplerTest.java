/**
** -----------------------------------------------------------------------------**
** PoissonDiskSamplerTest.java
**
** Tests for PoissonDiskSampler
**
**
** Copyright (C) 2014 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  PoissonDiskSamplerTest.java is free software: you can redistribute it and/or modify
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
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class PoissonDiskSamplerTest {

	@Test
	public void pointsKeepMinimalDistance() {
		PoissonDiskSampler sampler=new PoissonDiskSampler(200, 100, 150, 3L);
		double r=sampler.getMinDistance();
		for (int i=0;i<sampler.getNumSamples();i++){
			double [] a=sampler.getPoint(i);
			for (int j=i+1;j<sampler.getNumSamples();j++){
				double [] b=sampler.getPoint(j);
				double dx=a[0]-b[0];
				double dy=a[1]-b[1];
				assertTrue(Math.sqrt(dx*dx+dy*dy)>=r);
			}
		}
	}

	@Test
	public void pixelsStayInsideImage() {
		PoissonDiskSampler sampler=new PoissonDiskSampler(37, 23, 60, 11L);
		for (int i=0;i<sampler.getNumSamples();i++){
			int [] xy=sampler.getPixel(i);
			assertTrue(xy[0]>=0 && xy[0]<37);
			assertTrue(xy[1]>=0 && xy[1]<23);
		}
	}

	@Test
	public void countIsCloseToRequested() {
		PoissonDiskSampler sampler=new PoissonDiskSampler(512, 512, 256, 0L);
		int n=sampler.getNumSamples();
		assertTrue("generated "+n, (n>128) && (n<512));
	}

	@Test
	public void sameSeedSamePoints() {
		PoissonDiskSampler a=new PoissonDiskSampler(100, 80, 50, 42L);
		PoissonDiskSampler b=new PoissonDiskSampler(100, 80, 50, 42L);
		assertEquals(a.getNumSamples(), b.getNumSamples());
		for (int i=0;i<a.getNumSamples();i++) assertArrayEquals(a.getPoint(i), b.getPoint(i), 0.0);
	}

	@Test
	public void emptyAreaHasNoPoints() {
		assertEquals(0, new PoissonDiskSampler(0, 10, 5, 0L).getNumSamples());
	}
}
