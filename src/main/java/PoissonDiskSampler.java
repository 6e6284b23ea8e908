/**
** -----------------------------------------------------------------------------**
** PoissonDiskSampler.java
**
** Blue noise point sets over the image area (Bridson's algorithm)
**
**
** Copyright (C) 2014 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  PoissonDiskSampler.java is free software: you can redistribute it and/or modify
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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Poisson disk point set: no two points are closer than minDistance. Generated with
 * R. Bridson, "Fast Poisson disk sampling in arbitrary dimensions", SIGGRAPH 2007 sketch.
 * The number of points depends on the distance and the random sequence, it is only
 * approximately equal to the requested one.
 */
public class PoissonDiskSampler {
	public static final int    ATTEMPTS=30;      // candidates around each active point
	public static final double PACKING= 0.7;     // points per r^2 of area, approximately

	private final int width;
	private final int height;
	private final double minDistance;
	private final List<double[]> points;

	/**
	 * Generate point set with spacing selected to produce approximately numSamples points
	 * @param width area width, pixels
	 * @param height area height, pixels
	 * @param numSamples requested number of points
	 * @param seed random seed
	 */
	public PoissonDiskSampler(int width, int height, int numSamples, long seed){
		this(width, height, numSamples, getDistanceForCount(width, height, numSamples), seed);
	}

	public PoissonDiskSampler(int width, int height, int numSamples, double minDistance, long seed){
		this.width=width;
		this.height=height;
		this.minDistance=minDistance;
		this.points=generate(new Random(seed));
	}

	public static double getDistanceForCount(int width, int height, int numSamples){
		if (numSamples<1) numSamples=1;
		return Math.sqrt(PACKING*width*height/numSamples);
	}

	public int getNumSamples()     {return this.points.size();}
	public double getMinDistance() {return this.minDistance;}

	/**
	 * @param i point index
	 * @return {x,y} with sub-pixel precision
	 */
	public double [] getPoint(int i){
		return this.points.get(i).clone();
	}

	/**
	 * @param i point index
	 * @return {x,y} pixel containing the point
	 */
	public int [] getPixel(int i){
		double [] xy=this.points.get(i);
		int x=(int) Math.floor(xy[0]);
		int y=(int) Math.floor(xy[1]);
		if (x>=this.width)  x=this.width-1;
		if (y>=this.height) y=this.height-1;
		return new int[] {x,y};
	}

	private List<double[]> generate(Random random){
		List<double[]> result=new ArrayList<double[]>();
		if ((this.width<1) || (this.height<1)) return result;
		double cellSize=this.minDistance/Math.sqrt(2.0); // at most one point per cell
		int gridWidth= (int) Math.ceil(this.width/cellSize);
		int gridHeight=(int) Math.ceil(this.height/cellSize);
		int [] grid=new int[gridWidth*gridHeight];
		for (int i=0;i<grid.length;i++) grid[i]=-1;
		List<Integer> active=new ArrayList<Integer>();

		double [] first={random.nextDouble()*this.width, random.nextDouble()*this.height};
		addPoint(first, result, active, grid, gridWidth, cellSize);
		double r2=this.minDistance*this.minDistance;
		while (!active.isEmpty()){
			int activeIndex=random.nextInt(active.size());
			double [] center=result.get(active.get(activeIndex));
			boolean found=false;
			for (int attempt=0;attempt<ATTEMPTS;attempt++){
				// uniform in the annulus [r,2r)
				double angle=2.0*Math.PI*random.nextDouble();
				double radius=this.minDistance*Math.sqrt(1.0+3.0*random.nextDouble());
				double [] candidate={center[0]+radius*Math.cos(angle),center[1]+radius*Math.sin(angle)};
				if ((candidate[0]<0.0) || (candidate[0]>=this.width) || (candidate[1]<0.0) || (candidate[1]>=this.height)) continue;
				int cx=(int) (candidate[0]/cellSize);
				int cy=(int) (candidate[1]/cellSize);
				boolean tooClose=false;
				for (int gy=Math.max(cy-2,0);(gy<=Math.min(cy+2,gridHeight-1)) && !tooClose;gy++){
					for (int gx=Math.max(cx-2,0);gx<=Math.min(cx+2,gridWidth-1);gx++){
						int other=grid[gy*gridWidth+gx];
						if (other<0) continue;
						double dx=result.get(other)[0]-candidate[0];
						double dy=result.get(other)[1]-candidate[1];
						if ((dx*dx+dy*dy)<r2){
							tooClose=true;
							break;
						}
					}
				}
				if (!tooClose){
					addPoint(candidate, result, active, grid, gridWidth, cellSize);
					found=true;
					break;
				}
			}
			if (!found) active.remove(activeIndex);
		}
		return result;
	}

	private static void addPoint(double [] point, List<double[]> result, List<Integer> active, int [] grid, int gridWidth, double cellSize){
		int index=result.size();
		result.add(point);
		active.add(index);
		grid[((int) (point[1]/cellSize))*gridWidth+((int) (point[0]/cellSize))]=index;
	}
}
