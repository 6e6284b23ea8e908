/**
** -----------------------------------------------------------------------------**
** RawJpegEstimator.java
**
** Camera response from a registered RAW/JPEG pair of the same scene
**
**
** Copyright (C) 2014 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  RawJpegEstimator.java is free software: you can redistribute it and/or modify
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

import ij.ImagePlus;
import ij.ImageStack;

/**
 * No linear system here: for every JPEG code the median of the RAW codes observed
 * at the same pixels is the inverse response. The median tolerates pixels spoiled by
 * noise or imperfect registration.
 */
public class RawJpegEstimator {
	public static final int CODES=CRFHistograms.BINS;
	public int debugLevel=1;
	public int threadsMax=100;
	public boolean enforceMonotonic=false; // isotonic projection of the median curve

	public RawJpegEstimator(){}
	public RawJpegEstimator(int threadsMax, boolean enforceMonotonic, int debugLevel){
		this.threadsMax=threadsMax;
		this.enforceMonotonic=enforceMonotonic;
		this.debugLevel=debugLevel;
	}

	/**
	 * @param raw linear (RAW) image
	 * @param jpeg camera processed image of the same scene, pixel registered with raw
	 * @param filterSize moving average window applied to the curves, 0 - no smoothing
	 * @return response function, not normalized (RAW values are relative to RAW full scale)
	 * @throws CRFException INSUFFICIENT_DATA if an image is missing, DIMENSION_MISMATCH
	 * if the images differ in size or number of channels
	 */
	public CameraResponseFunction estimate(ImagePlus raw, ImagePlus jpeg, int filterSize) throws CRFException {
		if ((raw==null) || (jpeg==null)){
			throw new CRFException(CRFException.Kind.INSUFFICIENT_DATA, "Both RAW and JPEG images are needed");
		}
		return estimate(ExposureStack.getFloatChannels(raw), ExposureStack.getFloatChannels(jpeg), filterSize);
	}

	public CameraResponseFunction estimate(ImageStack raw, ImageStack jpeg, int filterSize) throws CRFException {
		if ((raw==null) || (jpeg==null)){
			throw new CRFException(CRFException.Kind.INSUFFICIENT_DATA, "Both RAW and JPEG images are needed");
		}
		if ((raw.getWidth()!=jpeg.getWidth()) || (raw.getHeight()!=jpeg.getHeight()) || (raw.getSize()!=jpeg.getSize())){
			throw new CRFException(CRFException.Kind.DIMENSION_MISMATCH,
					"RAW image is "+raw.getWidth()+"x"+raw.getHeight()+"x"+raw.getSize()+
					", JPEG image is "+jpeg.getWidth()+"x"+jpeg.getHeight()+"x"+jpeg.getSize());
		}
		for (int chn=0;chn<raw.getSize();chn++){
			if (!(raw.getPixels(chn+1) instanceof float[]) || !(jpeg.getPixels(chn+1) instanceof float[])){
				throw new CRFException(CRFException.Kind.INVALID_PARAMETER, "Channel "+chn+" of RAW or JPEG image is not a float image");
			}
		}
		int [][][] joint=CRFHistograms.jointHistograms(raw, jpeg, this.threadsMax);
		return estimate(joint, filterSize);
	}

	/**
	 * @param joint [channel][RAW code][JPEG code] occurrence counts
	 * @param filterSize moving average window applied to the curves, 0 - no smoothing
	 * @return response function, not normalized
	 * @throws CRFException INSUFFICIENT_DATA if a channel has no observations at all
	 */
	public CameraResponseFunction estimate(int [][][] joint, int filterSize) throws CRFException {
		float [][] icrf=new float[joint.length][];
		for (int chn=0;chn<joint.length;chn++){
			double [] curve=medianCurve(joint[chn]);
			int numObserved=fillMissing(curve);
			if (numObserved==0){
				throw new CRFException(CRFException.Kind.INSUFFICIENT_DATA, "Channel "+chn+" has no pixels");
			}
			if (this.debugLevel>1) System.out.println("RawJpegEstimator: channel "+chn+" has "+numObserved+" observed JPEG codes");
			if (filterSize>0) curve=meanFilter(curve, filterSize);
			if (this.enforceMonotonic) curve=CameraResponseFunction.makeMonotonic(curve);
			icrf[chn]=new float[CODES];
			for (int i=0;i<CODES;i++) icrf[chn][i]=(float) curve[i];
		}
		return new CameraResponseFunction(icrf, CameraResponseFunction.Source.RAW_JPEG, null);
	}

	/**
	 * For every JPEG code j the median (element size/2 of the sorted list) of the RAW codes
	 * that have nonzero count in column j, divided by 255
	 * @param joint [RAW code][JPEG code] counts of one channel
	 * @return 256 values, NaN for JPEG codes that were never observed
	 */
	public static double [] medianCurve(int [][] joint){
		double [] curve=new double[CODES];
		int [] coords=new int[CODES];
		for (int j=0;j<CODES;j++){
			int n=0;
			for (int i=0;i<CODES;i++){
				if (joint[i][j]>0) coords[n++]=i; // ascending
			}
			if (n==0){
				curve[j]=Double.NaN;
			} else {
				curve[j]=coords[n>>1]/((double) ExposureStack.MAX_CODE);
			}
		}
		return curve;
	}

	/**
	 * Replace NaN values with linear interpolation between the nearest defined ones,
	 * copy the nearest defined value beyond the first/last one
	 * @param curve values, modified in place
	 * @return number of defined values
	 */
	static int fillMissing(double [] curve){
		int previous=-1;
		int numDefined=0;
		for (int i=0;i<curve.length;i++){
			if (Double.isNaN(curve[i])) continue;
			numDefined++;
			if (previous<0){
				for (int k=0;k<i;k++) curve[k]=curve[i];
			} else {
				for (int k=previous+1;k<i;k++){
					double a=((double) (k-previous))/(i-previous);
					curve[k]=(1.0-a)*curve[previous]+a*curve[i];
				}
			}
			previous=i;
		}
		if (previous>=0){
			for (int k=previous+1;k<curve.length;k++) curve[k]=curve[previous];
		}
		return numDefined;
	}

	/**
	 * Moving average, out-of-range values are replaced with the nearest end value
	 * @param data input, not modified
	 * @param size window size (odd sizes are centered, even ones extend one more to the left)
	 * @return filtered data
	 */
	public static double [] meanFilter(double [] data, int size){
		if (size<=1) return data.clone();
		int left=size/2;
		int right=size-1-left;
		int n=data.length;
		double [] result=new double[n];
		for (int i=0;i<n;i++){
			double sum=0.0;
			for (int k=i-left;k<=i+right;k++){
				int index=(k<0)?0:((k>=n)?(n-1):k);
				sum+=data[index];
			}
			result[i]=sum/size;
		}
		return result;
	}
}
