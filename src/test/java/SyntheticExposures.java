/**
** -----------------------------------------------------------------------------**
** SyntheticExposures.java
**
** Synthetic exposures of a camera with gamma 2.2 response for tests
**
**
** Copyright (C) 2014 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  SyntheticExposures.java is free software: you can redistribute it and/or modify
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
 * Images of a synthetic scene taken by a camera with known response
 */
public class SyntheticExposures {
	public static final double GAMMA=2.2;

	/**
	 * Irradiance grows exponentially along x from eMin to eMax, constant along y
	 */
	public static double irradiance(int x, int width, double eMin, double eMax){
		double a=(width>1)?(((double) x)/(width-1)):0.0;
		return Math.exp(Math.log(eMin)+a*(Math.log(eMax)-Math.log(eMin)));
	}

	/**
	 * 8-bit camera with response v=(E*t)^(1/2.2), clipped at 1.0
	 */
	public static float deviceValue(double irradiance, double exposure){
		double v=irradiance*exposure;
		if (v>1.0) v=1.0;
		v=Math.pow(v, 1.0/GAMMA);
		return (float) (Math.round(v*255.0)/255.0);
	}

	public static ImageStack exposure(int width, int height, int numChannels, double exposure, double eMin, double eMax){
		ImageStack stack=new ImageStack(width, height);
		for (int chn=0;chn<numChannels;chn++){
			float [] pixels=new float[width*height];
			// channels see slightly different scenes
			double scale=1.0-0.1*chn;
			for (int y=0;y<height;y++) for (int x=0;x<width;x++){
				pixels[y*width+x]=deviceValue(scale*irradiance(x, width, eMin, eMax), exposure);
			}
			stack.addSlice("channel-"+chn, pixels);
		}
		return stack;
	}

	public static ExposureStack gammaStack(int width, int height, int numChannels, double [] exposures) throws CRFException {
		ImageStack [] stacks=new ImageStack[exposures.length];
		for (int n=0;n<exposures.length;n++) stacks[n]=exposure(width, height, numChannels, exposures[n], 0.004, 0.25);
		return new ExposureStack(stacks, exposures);
	}

	public static ImageStack constant(int width, int height, float... channelValues){
		ImageStack stack=new ImageStack(width, height);
		for (int chn=0;chn<channelValues.length;chn++){
			float [] pixels=new float[width*height];
			for (int i=0;i<pixels.length;i++) pixels[i]=channelValues[chn];
			stack.addSlice("channel-"+chn, pixels);
		}
		return stack;
	}

	public static ImagePlus withExposure(String title, ImageStack stack, double exposure){
		ImagePlus imp=new ImagePlus(title, stack);
		imp.setProperty(ExposureStack.EXPOSURE_PROPERTY, Double.toString(exposure));
		return imp;
	}

	/**
	 * Inverse response of the synthetic camera, strictly increasing
	 */
	public static float [] gammaCurve(){
		float [] curve=new float[256];
		for (int i=0;i<curve.length;i++) curve[i]=(float) Math.pow(i/255.0, GAMMA);
		return curve;
	}
}
