/**
** -----------------------------------------------------------------------------**
** CRFApplicator.java
**
** Converts pixel values between device code and linear irradiance domains
**
**
** Copyright (C) 2014 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  CRFApplicator.java is free software: you can redistribute it and/or modify
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

import ij.IJ;
import ij.ImagePlus;
import ij.ImageStack;

/**
 * Linearization (device to linear) and response application (linear to device) of
 * float images, one slice per color channel, values in [0,1]. Pixels are modified in
 * place. The methods run as steps of a larger pipeline, so problems are logged and the
 * image is left untouched instead of throwing; callers that need to know check the
 * returned value.
 */
public class CRFApplicator {
	public static final double GAMMA=2.2;

	public enum LinearizationMode {
		LINEAR    ("Linear (no conversion)"),
		GAMMA_2_2 ("Gamma 2.2"),
		LUT_8_BIT ("Estimated response, 8-bit lookup table");
		private final String description;
		LinearizationMode(String description) {this.description=description;}
		public String getDescription() {return this.description;}
	}

	private final CameraResponseFunction crf; // may be null for LINEAR and GAMMA_2_2
	public int debugLevel=1;

	public CRFApplicator(CameraResponseFunction crf){
		this.crf=crf;
	}

	public CRFApplicator(CameraResponseFunction crf, int debugLevel){
		this.crf=crf;
		this.debugLevel=debugLevel;
	}

	public CameraResponseFunction getResponseFunction() {return this.crf;}

	/**
	 * Device value to linear value
	 * @param x value in [0,1]
	 * @param mode conversion
	 * @param icrf 256-entry inverse response of the channel, used for LUT_8_BIT only
	 * @return linear value
	 */
	public static double removeCRF(double x, LinearizationMode mode, float [] icrf){
		switch (mode){
		case LINEAR:
			return x;
		case GAMMA_2_2:
			return Math.pow(x, GAMMA);
		case LUT_8_BIT:
			return icrf[ExposureStack.toCode(x)];
		default:
			throw new IllegalArgumentException("Unknown linearization mode "+mode);
		}
	}

	/**
	 * Linear value to device value
	 * @param x linear value, expected within the range of icrf for LUT_8_BIT
	 * @param mode conversion
	 * @param icrf 256-entry non-decreasing inverse response of the channel, used for LUT_8_BIT only
	 * @return value in [0,1]
	 */
	public static double applyCRF(double x, LinearizationMode mode, float [] icrf){
		switch (mode){
		case LINEAR:
			return x;
		case GAMMA_2_2:
			return Math.pow(x, 1.0/GAMMA);
		case LUT_8_BIT:
			return lowerBound(icrf, x)/((double) ExposureStack.MAX_CODE);
		default:
			throw new IllegalArgumentException("Unknown linearization mode "+mode);
		}
	}

	/**
	 * Binary search for the first of the first 255 entries that is not less than x.
	 * Meaningful for non-decreasing tables only.
	 * @param icrf 256 values
	 * @param x value to find
	 * @return index in [0,255], 255 when all of the first 255 entries are less than x
	 */
	static int lowerBound(float [] icrf, double x){
		int low=0;
		int high=icrf.length-1; // last entry excluded
		while (low<high){
			int mid=(low+high)>>>1;
			if (icrf[mid]<x) low=mid+1;
			else high=mid;
		}
		return low;
	}

	public boolean linearize(ImagePlus imp, LinearizationMode mode){
		if (imp==null) return false;
		boolean result=linearize(imp.getStack(), mode);
		if (result) imp.updateAndDraw();
		return result;
	}

	public boolean applyResponse(ImagePlus imp, LinearizationMode mode){
		if (imp==null) return false;
		boolean result=applyResponse(imp.getStack(), mode);
		if (result) imp.updateAndDraw();
		return result;
	}

	/**
	 * Replace device values of every channel with linear ones
	 * @param stack float slices, one per color channel
	 * @param mode conversion
	 * @return false (and the stack is not modified) if the conversion is not possible
	 */
	public boolean linearize(ImageStack stack, LinearizationMode mode){
		if (!isCompatible(stack, mode, "linearized")) return false;
		for (int chn=0;chn<stack.getSize();chn++){
			float [] pixels=(float []) stack.getPixels(chn+1);
			float [] icrf=(mode==LinearizationMode.LUT_8_BIT)?this.crf.getCurve(chn):null;
			for (int i=0;i<pixels.length;i++) pixels[i]=(float) removeCRF(pixels[i], mode, icrf);
		}
		return true;
	}

	/**
	 * Replace linear values of every channel with device ones
	 * @param stack float slices, one per color channel
	 * @param mode conversion
	 * @return false (and the stack is not modified) if the conversion is not possible
	 */
	public boolean applyResponse(ImageStack stack, LinearizationMode mode){
		if (!isCompatible(stack, mode, "converted by the camera response")) return false;
		if ((mode==LinearizationMode.LUT_8_BIT) && !this.crf.isMonotonic() && (this.debugLevel>0)){
			IJ.log("Warning: camera response is not monotonic, inverse lookup may be wrong");
		}
		for (int chn=0;chn<stack.getSize();chn++){
			float [] pixels=(float []) stack.getPixels(chn+1);
			float [] icrf=(mode==LinearizationMode.LUT_8_BIT)?this.crf.getCurve(chn):null;
			for (int i=0;i<pixels.length;i++) pixels[i]=(float) applyCRF(pixels[i], mode, icrf);
		}
		return true;
	}

	/**
	 * Strict variant of the compatibility test for callers that can not skip the step
	 * @param stack float slices, one per color channel
	 * @param mode conversion
	 * @throws CRFException CHANNEL_COUNT_MISMATCH or INVALID_PARAMETER
	 */
	public void requireCompatible(ImageStack stack, LinearizationMode mode) throws CRFException {
		if (stack==null) throw new CRFException(CRFException.Kind.INVALID_PARAMETER, "No image");
		for (int chn=0;chn<stack.getSize();chn++){
			if (!(stack.getPixels(chn+1) instanceof float[])){
				throw new CRFException(CRFException.Kind.INVALID_PARAMETER, "Channel "+chn+" is not a float image");
			}
		}
		if (mode!=LinearizationMode.LUT_8_BIT) return;
		if (this.crf==null) throw new CRFException(CRFException.Kind.INVALID_PARAMETER, "No camera response function");
		if (this.crf.getNumChannels()!=stack.getSize()){
			throw new CRFException(CRFException.Kind.CHANNEL_COUNT_MISMATCH, "Camera response has "+this.crf.getNumChannels()+
					" channels, image has "+stack.getSize());
		}
	}

	private boolean isCompatible(ImageStack stack, LinearizationMode mode, String what){
		try {
			requireCompatible(stack, mode);
			return true;
		} catch (CRFException e){
			if (this.debugLevel>0) IJ.log("Warning: image cannot be "+what+": "+e.getMessage());
			return false;
		}
	}
}
