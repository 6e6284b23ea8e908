/**
** -----------------------------------------------------------------------------**
** CRFWeightFunction.java
**
** Confidence weights of the device codes used in camera response estimation
**
**
** Copyright (C) 2014 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  CRFWeightFunction.java is free software: you can redistribute it and/or modify
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

/**
 * Weight of a normalized device code x in [0,1]. Low weights are given to codes
 * close to the noise floor and to saturation, where the response is least reliable.
 */
public enum CRFWeightFunction {
	/** Uniform weight, 1.0 for every code */
	ALL ("Uniform"){
		public double weight(double x) {
			return 1.0;
		}
	},
	/** 1-((2x-1)^2)^4: 0.0 at both ends, 1.0 in the middle */
	HAT ("Hat"){
		public double weight(double x) {
			double val=2.0*x-1.0;
			double val2=val*val;
			double val4=val2*val2;
			return 1.0-val4*val4;
		}
	},
	/** exp(-4(x-mu)^2/(2*sigma^2)), mu=sigma=0.5 */
	GAUSS ("Gaussian"){
		public double weight(double x) {
			return gauss(x);
		}
	},
	/** Gaussian shifted and scaled so the tails reach 0.0 at x=0 and x=1 */
	GAUSS_SHIFTED ("Gaussian, zero tails"){
		public double weight(double x) {
			double shift=gauss(0.0);
			double y=(gauss(x)-shift)/(1.0-shift);
			if (y<0.0) return 0.0;
			if (y>1.0) return 1.0;
			return y;
		}
	},
	/** Debevec-Malik 1997 triangle over [0,1] */
	DEB97 ("Triangular (Debevec), full range"){
		public double weight(double x) {
			return triangle(x,0.0,1.0);
		}
	},
	/** Debevec-Malik triangle over [0.01,0.99], codes outside get small nonzero weight */
	DEB97P01 ("Triangular (Debevec), padded range"){
		public double weight(double x) {
			return Math.abs(triangle(x,0.01,0.99));
		}
	};

	public static final int CODES=256;
	private static final double GAUSS_MU=   0.5;
	private static final double GAUSS_SIGMA=0.5;

	private final String description;

	CRFWeightFunction(String description) {
		this.description=description;
	}

	public abstract double weight(double x);

	public String getDescription() {return this.description;}

	/**
	 * Weight of every device code, code/255 is used as the normalized value
	 * @return array of 256 weights
	 */
	public double [] getTable(){
		double [] w=new double[CODES];
		for (int i=0;i<CODES;i++) w[i]=weight(i/(CODES-1.0));
		return w;
	}

	public static String [] getDescriptions(){
		CRFWeightFunction [] values=values();
		String [] descriptions=new String[values.length];
		for (int i=0;i<values.length;i++) descriptions[i]=values[i].description;
		return descriptions;
	}

	private static double gauss(double x){
		double sigma2x2=2.0*GAUSS_SIGMA*GAUSS_SIGMA;
		double xMu=x-GAUSS_MU;
		return Math.exp(-4.0*xMu*xMu/sigma2x2);
	}

	private static double triangle(double x, double zMin, double zMax){
		double tr=(zMin+zMax)/2.0;
		return (x<=tr)?(x-zMin):(zMax-x);
	}
}
